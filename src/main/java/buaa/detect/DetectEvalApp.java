package buaa.detect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DetectEvalApp {

    public static void main(String[] args) {
        SpringApplication.run(DetectEvalApp.class, args);
    }
}
