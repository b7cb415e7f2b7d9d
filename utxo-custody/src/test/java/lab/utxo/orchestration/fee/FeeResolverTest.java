package lab.utxo.orchestration.fee;

import lab.utxo.adapter.LedgerApiException;
import lab.utxo.adapter.SafeLedgerClient;
import lab.utxo.domain.asset.Fee;
import lab.utxo.domain.asset.SafeAsset;
import lab.utxo.domain.withdrawal.FeeFlow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeeResolverTest {

    private static final SafeAsset BTC = asset("btc", "btc");
    private static final SafeAsset ETH = asset("eth", "eth");
    private static final SafeAsset USDT = asset("usdt-erc20", "eth");

    @Mock SafeLedgerClient ledgerClient;
    @InjectMocks FeeResolver resolver;

    private static SafeAsset asset(String assetId, String chainId) {
        return new SafeAsset(assetId, chainId, assetId.toUpperCase(), assetId, BigDecimal.ONE, BigDecimal.ONE);
    }

    @Test
    void assetWithoutChainIdIsLedgerFault() {
        when(ledgerClient.fetchAsset("orphan")).thenReturn(asset("orphan", null));

        assertThatThrownBy(() -> resolver.resolve("orphan", "dest"))
                .isInstanceOf(LedgerApiException.class)
                .hasMessageContaining("without a chain id");
        verify(ledgerClient, times(1)).fetchAsset(anyString());
    }

    @Test
    void chainAssetIsNotLookedUpTwice() {
        when(ledgerClient.fetchAsset("btc")).thenReturn(BTC);
        when(ledgerClient.fetchFees("btc", "bc1q-dest")).thenReturn(List.of(new Fee("btc", new BigDecimal("0.0001"))));

        FeeResolution resolution = resolver.resolve("btc", "bc1q-dest");

        assertThat(resolution.chainAsset()).isSameAs(resolution.asset());
        assertThat(resolution.flow()).isEqualTo(FeeFlow.SAME_ASSET_FEE);
        assertThat(resolution.isTwoPhase()).isFalse();
        verify(ledgerClient, times(1)).fetchAsset(anyString());
    }

    @Test
    void tokenFeeInChainAssetSelectsTwoPhaseFlow() {
        when(ledgerClient.fetchAsset("usdt-erc20")).thenReturn(USDT);
        when(ledgerClient.fetchAsset("eth")).thenReturn(ETH);
        when(ledgerClient.fetchFees("usdt-erc20", "0xdest")).thenReturn(List.of(new Fee("eth", new BigDecimal("0.002"))));

        FeeResolution resolution = resolver.resolve("usdt-erc20", "0xdest");

        assertThat(resolution.chainAsset()).isEqualTo(ETH);
        assertThat(resolution.fee().assetId()).isEqualTo("eth");
        assertThat(resolution.flow()).isEqualTo(FeeFlow.CHAIN_ASSET_FEE);
        verify(ledgerClient, times(2)).fetchAsset(anyString());
    }

    @Test
    void ownAssetQuoteWinsOverChainQuote() {
        when(ledgerClient.fetchAsset("usdt-erc20")).thenReturn(USDT);
        when(ledgerClient.fetchAsset("eth")).thenReturn(ETH);
        when(ledgerClient.fetchFees("usdt-erc20", "0xdest")).thenReturn(List.of(
                new Fee("eth", new BigDecimal("0.002")),
                new Fee("usdt-erc20", new BigDecimal("3"))
        ));

        FeeResolution resolution = resolver.resolve("usdt-erc20", "0xdest");

        assertThat(resolution.fee()).isEqualTo(new Fee("usdt-erc20", new BigDecimal("3")));
        assertThat(resolution.flow()).isEqualTo(FeeFlow.SAME_ASSET_FEE);
    }

    @Test
    void missingQuoteIsFatal() {
        when(ledgerClient.fetchAsset("usdt-erc20")).thenReturn(USDT);
        when(ledgerClient.fetchAsset("eth")).thenReturn(ETH);
        when(ledgerClient.fetchFees("usdt-erc20", "0xdest")).thenReturn(List.of(new Fee("some-other-asset", BigDecimal.ONE)));

        assertThatThrownBy(() -> resolver.resolve("usdt-erc20", "0xdest"))
                .isInstanceOfSatisfying(NoFeeQuoteException.class,
                        e -> assertThat(e.getCode()).isEqualTo("NO_FEE_QUOTE"));
    }
}
