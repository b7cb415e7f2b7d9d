package lab.utxo.domain.recipient;

import java.math.BigDecimal;

/**
 * One output of a transaction being planned.
 * Group recipients are paid to a multisig member set and need ghost keys;
 * address recipients are external withdrawal destinations and never do.
 */
public sealed interface Recipient permits GroupRecipient, AddressRecipient {

    BigDecimal amount();
}
