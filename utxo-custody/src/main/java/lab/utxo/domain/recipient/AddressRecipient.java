package lab.utxo.domain.recipient;

import java.math.BigDecimal;

public record AddressRecipient(
        String destination,
        String tag,
        BigDecimal amount
) implements Recipient {
}
