package lab.utxo.balance;

import lab.utxo.domain.asset.SafeAsset;
import lab.utxo.sim.fakeledger.FakeSafeLedger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static lab.utxo.SafeFixtures.APP_ID;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

// Fresh context: the balance totals cover every output in the in-memory ledger.
@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.BEFORE_CLASS)
class BalanceControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private FakeSafeLedger ledger;

    @Test
    void balancesArePricedPerAssetAndTotalled() throws Exception {
        ledger.putAsset(new SafeAsset("bal-a", "bal-a", "AAA", "Asset A", new BigDecimal("10"), new BigDecimal("0.0002")));
        ledger.putAsset(new SafeAsset("bal-b", "bal-a", "BBB", "Asset B", new BigDecimal("1"), new BigDecimal("0.00002")));
        ledger.seedOutput("bal-a", new BigDecimal("3"), List.of(APP_ID), 1);
        ledger.seedOutput("bal-a", new BigDecimal("2"), List.of(APP_ID), 1);
        ledger.seedOutput("bal-b", new BigDecimal("5"), List.of(APP_ID), 1);

        mockMvc.perform(get("/balances").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balances.length()").value(2))
                .andExpect(jsonPath("$.balances[0].assetId").value("bal-a"))
                .andExpect(jsonPath("$.balances[0].balance").value("5.00000000"))
                .andExpect(jsonPath("$.balances[0].balanceUsd").value("50.00"))
                .andExpect(jsonPath("$.balances[1].balanceUsd").value("5.00"))
                .andExpect(jsonPath("$.totalUSDBalance").value("55.00"))
                .andExpect(jsonPath("$.totalBTCBalance").value("0.00110000"));

        mockMvc.perform(get("/safe/outputs").param("assetId", "bal-a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(post("/safe/deposit-entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chainId\":\"bal-a\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chainId").value("bal-a"))
                .andExpect(jsonPath("$.destination").value(startsWith("0x")));
    }

    @Test
    void unknownTransactionIsReportedAsLedgerError() throws Exception {
        mockMvc.perform(get("/safe/transactions/{hash}", "deadbeef"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("LEDGER_ERROR"));
    }
}
