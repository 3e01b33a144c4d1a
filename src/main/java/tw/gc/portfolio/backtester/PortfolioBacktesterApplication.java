package tw.gc.portfolio.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortfolioBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioBacktesterApplication.class, args);
    }
}
