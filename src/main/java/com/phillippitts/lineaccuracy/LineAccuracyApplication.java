package com.phillippitts.lineaccuracy;

import com.phillippitts.lineaccuracy.config.accuracy.AccuracyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AccuracyProperties.class
})
public class LineAccuracyApplication {

    public static void main(String[] args) {
        SpringApplication.run(LineAccuracyApplication.class, args);
    }

}
