package com.phillippitts.tagprobe.config;

import com.phillippitts.tagprobe.tag.TagDecoders;
import com.phillippitts.tagprobe.tag.TechnicalOnlyTagDecoders;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the default tag decoders and logs the effective read limits at startup.
 *
 * <p>Declare a {@link TagDecoders} bean to replace {@link TechnicalOnlyTagDecoders}.
 */
@Configuration
public class ReaderConfig {

    private static final Logger LOG = LogManager.getLogger(ReaderConfig.class);

    private final TagProbeProperties properties;

    public ReaderConfig(TagProbeProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void logReadLimits() {
        LOG.info("Read limits configured: maxUpfrontBytes={}, maxWrapDepth={}",
                properties.maxUpfrontBytes(), properties.maxWrapDepth());
    }

    @Bean
    @ConditionalOnMissingBean(TagDecoders.class)
    public TagDecoders tagDecoders() {
        LOG.info("No TagDecoders bean declared; results carry technical fields only");
        return new TechnicalOnlyTagDecoders();
    }
}
