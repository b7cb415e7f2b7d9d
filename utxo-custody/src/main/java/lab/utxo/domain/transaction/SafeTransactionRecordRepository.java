package lab.utxo.domain.transaction;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SafeTransactionRecordRepository extends JpaRepository<SafeTransactionRecord, UUID> {

    List<SafeTransactionRecord> findByWithdrawalIdOrderBySequenceNoAsc(UUID withdrawalId);
}
