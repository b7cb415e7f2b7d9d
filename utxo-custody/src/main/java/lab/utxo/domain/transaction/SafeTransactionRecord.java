package lab.utxo.domain.transaction;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "safe_transactions",
       indexes = {
           @Index(name = "idx_safe_tx_withdrawal", columnList = "withdrawalId"),
           @Index(name = "idx_safe_tx_hash", columnList = "transactionHash")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class SafeTransactionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private UUID withdrawalId;

    @Column(nullable = false)
    private int sequenceNo; // 1..N in submission order

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SafeTransactionKind kind;

    @Column(nullable = false, length = 64)
    private String requestId;

    @Column(nullable = false, length = 128)
    private String transactionHash;

    @Column(nullable = false, length = 64)
    private String memo;

    @Column(length = 32)
    private String state;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static SafeTransactionRecord submitted(
            UUID withdrawalId,
            int sequenceNo,
            SafeTransactionKind kind,
            SubmittedTransaction tx,
            String memo) {
        return SafeTransactionRecord.builder()
                .withdrawalId(withdrawalId)
                .sequenceNo(sequenceNo)
                .kind(kind)
                .requestId(tx.requestId())
                .transactionHash(tx.transactionHash())
                .memo(memo)
                .state(tx.state())
                .createdAt(Instant.now())
                .build();
    }
}
