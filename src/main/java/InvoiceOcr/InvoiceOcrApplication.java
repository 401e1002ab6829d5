package InvoiceOcr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class InvoiceOcrApplication {

    public static void main(String[] args) {
        System.setProperty("java.net.preferIPv4Stack", "true");

        SpringApplication app = new SpringApplication(InvoiceOcrApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        int exitCode = SpringApplication.exit(app.run(args));
        System.exit(exitCode);
    }
}
