package lab.utxo.domain.utxo;

/**
 * Filter for output listing. A null assetId lists every asset.
 */
public record UtxoQuery(
        String assetId,
        String state
) {

    public static UtxoQuery unspent(String assetId) {
        return new UtxoQuery(assetId, UnspentOutput.STATE_UNSPENT);
    }

    public static UtxoQuery allUnspent() {
        return new UtxoQuery(null, UnspentOutput.STATE_UNSPENT);
    }
}
