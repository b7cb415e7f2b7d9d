package lab.utxo.common;

import lab.utxo.adapter.LedgerApiException;
import lab.utxo.orchestration.AmountTooSmallException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@Import(GlobalExceptionHandlerTest.TestConfig.class)
@AutoConfigureMockMvc
class GlobalExceptionHandlerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void runtimeExceptionMessageIsSanitized() throws Exception {
        mockMvc.perform(get("/test-error/runtime").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isInternalServerError())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status").value(500))
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.path").value("/test-error/runtime"))
                .andExpect(jsonPath("$.message").value("Failed with secret [REDACTED]"));
    }

    @Test
    void ledgerFailureMapsToBadGatewayWithoutLeakingKeys() throws Exception {
        mockMvc.perform(get("/test-error/ledger").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("LEDGER_ERROR"))
                .andExpect(jsonPath("$.message").value("signature rejected for view [REDACTED]"));
    }

    @Test
    void internalArgumentFailureIsNotBlamedOnTheCaller() throws Exception {
        mockMvc.perform(get("/test-error/internal-argument").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
    }

    @Test
    void withdrawalExceptionCarriesItsCode() throws Exception {
        mockMvc.perform(get("/test-error/too-small").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value(422))
                .andExpect(jsonPath("$.code").value("AMOUNT_TOO_SMALL"));
    }

    @TestConfiguration
    static class TestConfig {
        @Bean
        TestErrorController testErrorController() {
            return new TestErrorController();
        }
    }

    @RestController
    static class TestErrorController {
        @GetMapping("/test-error/runtime")
        String runtime() {
            throw new IllegalStateException("Failed with secret 0x0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef");
        }

        @GetMapping("/test-error/ledger")
        String ledger() {
            throw new LedgerApiException(403, "signature rejected for view " + "ab".repeat(32));
        }

        @GetMapping("/test-error/internal-argument")
        String internalArgument() {
            throw new IllegalArgumentException("invalid threshold 0 for 0 members");
        }

        @GetMapping("/test-error/too-small")
        String tooSmall() {
            throw new AmountTooSmallException(new BigDecimal("1"), new BigDecimal("2"));
        }
    }
}
