package lab.utxo.domain.recipient;

import java.math.BigDecimal;
import java.util.List;

public record GroupRecipient(
        List<String> members,
        int threshold,
        BigDecimal amount
) implements Recipient {

    public GroupRecipient {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("group recipient requires at least one member");
        }
        if (threshold < 1 || threshold > members.size()) {
            throw new IllegalArgumentException("invalid threshold " + threshold + " for " + members.size() + " members");
        }
        members = List.copyOf(members);
    }

    public static GroupRecipient single(String member, BigDecimal amount) {
        return new GroupRecipient(List.of(member), 1, amount);
    }
}
