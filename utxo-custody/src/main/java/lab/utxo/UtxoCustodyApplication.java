package lab.utxo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UtxoCustodyApplication {

    public static void main(String[] args) {
        SpringApplication.run(UtxoCustodyApplication.class, args);
    }
}
