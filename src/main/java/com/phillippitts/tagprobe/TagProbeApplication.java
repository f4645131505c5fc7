package com.phillippitts.tagprobe;

import com.phillippitts.tagprobe.config.TagProbeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(TagProbeProperties.class)
public class TagProbeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TagProbeApplication.class, args);
    }

}
