package lab.utxo.domain.withdrawal;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "withdrawals",
       indexes = {
           @Index(name = "idx_withdrawal_idem", columnList = "idempotencyKey", unique = true)
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Withdrawal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 128)
    private String idempotencyKey;

    @Column(nullable = false, length = 64)
    private String assetId;

    @Column(nullable = false, length = 256)
    private String destination;

    @Column(length = 128)
    private String tag;

    @Column(nullable = false, precision = 38, scale = 8)
    private BigDecimal amount;

    @Column(length = 64)
    private String feeAssetId;

    @Column(precision = 38, scale = 8)
    private BigDecimal feeAmount;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private FeeFlow feeFlow;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private WithdrawalStatus status;

    @Column(length = 128)
    private String feeTransactionHash;

    @Column(length = 128)
    private String transactionHash;

    @Column(length = 500)
    private String failureReason;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public void transitionTo(WithdrawalStatus next) {
        if (next.ordinal() < this.status.ordinal()) {
            throw new IllegalStateException("invalid withdrawal status transition: " + this.status + " -> " + next);
        }
        this.status = next;
        this.updatedAt = Instant.now();
    }

    public void recordFee(String feeAssetId, BigDecimal feeAmount, FeeFlow feeFlow) {
        this.feeAssetId = feeAssetId;
        this.feeAmount = feeAmount;
        this.feeFlow = feeFlow;
        transitionTo(WithdrawalStatus.W1_FEE_RESOLVED);
    }

    public void recordFeeTransaction(String feeTransactionHash) {
        this.feeTransactionHash = feeTransactionHash;
        transitionTo(WithdrawalStatus.W2_FEE_TX_SENT);
    }

    public void recordSent(String transactionHash) {
        this.transactionHash = transactionHash;
        transitionTo(WithdrawalStatus.W3_SENT);
    }

    public void markFailed(String reason) {
        this.failureReason = truncate(reason);
        transitionTo(feeTransactionHash != null ? WithdrawalStatus.W9_FEE_UNRECONCILED : WithdrawalStatus.W8_FAILED);
    }

    public static Withdrawal requested(
        String idempotencyKey,
        String assetId,
        String destination,
        String tag,
        BigDecimal amount) {
        Instant now = Instant.now();
        return Withdrawal.builder()
                .idempotencyKey(idempotencyKey)
                .assetId(assetId)
                .destination(destination)
                .tag(tag)
                .amount(amount)
                .status(WithdrawalStatus.W0_REQUESTED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return "Unknown error";
        }
        return reason.length() > 500 ? reason.substring(0, 500) : reason;
    }
}
