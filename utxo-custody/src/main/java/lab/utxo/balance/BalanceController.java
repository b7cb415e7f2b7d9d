package lab.utxo.balance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.RoundingMode;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/balances")
@Slf4j
public class BalanceController {

    private final BalanceService balanceService;

    @GetMapping
    public ResponseEntity<BalanceResponse> get() {
        log.info("event=balance.get.request");
        BalanceSummary summary = balanceService.getBalances();
        BalanceResponse body = new BalanceResponse(
                summary.balances(),
                summary.totalUsd().setScale(2, RoundingMode.HALF_UP).toPlainString(),
                summary.totalBtc().setScale(8, RoundingMode.HALF_UP).toPlainString()
        );
        log.info("event=balance.get.response assets={} totalUsd={}", body.balances().size(), body.totalUSDBalance());
        return ResponseEntity.ok(body);
    }

    public record BalanceResponse(
            List<AssetBalance> balances,
            String totalUSDBalance,
            String totalBTCBalance
    ) {}
}
