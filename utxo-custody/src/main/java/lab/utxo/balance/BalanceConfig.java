package lab.utxo.balance;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class BalanceConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService balanceLookupExecutor(@Value("${custody.balance.lookup-threads:4}") int threads) {
        if (threads < 1) {
            throw new IllegalStateException("custody.balance.lookup-threads must be at least 1");
        }
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "balance-lookup-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
