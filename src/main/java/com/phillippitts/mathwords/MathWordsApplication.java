package com.phillippitts.mathwords;

import com.phillippitts.mathwords.config.properties.MathWordsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        MathWordsProperties.class
})
public class MathWordsApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathWordsApplication.class, args);
    }

}
