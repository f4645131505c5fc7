package com.phillippitts.tagprobe.config;

import com.phillippitts.tagprobe.domain.TagFields;
import com.phillippitts.tagprobe.stream.ByteArraySeekableStream;
import com.phillippitts.tagprobe.tag.TagDecoders;
import com.phillippitts.tagprobe.tag.TechnicalOnlyTagDecoders;
import com.phillippitts.tagprobe.testutil.RecordingTagDecoders;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class ReaderConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfig.class, ReaderConfig.class);

    @Test
    void createsTechnicalOnlyDecoders() {
        ReaderConfig config = new ReaderConfig(new TagProbeProperties(1024, 2));

        assertThat(config.tagDecoders()).isInstanceOf(TechnicalOnlyTagDecoders.class);
    }

    @Test
    void providesTechnicalOnlyDecodersByDefault() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(TagDecoders.class);
            assertThat(context.getBean(TagDecoders.class)).isInstanceOf(TechnicalOnlyTagDecoders.class);
        });
    }

    @Test
    void backsOffWhenApplicationDeclaresDecoders() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
                .withUserConfiguration(CustomDecoders.class, PropertiesConfig.class, ReaderConfig.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(TagDecoders.class);
                    assertThat(context.getBean(TagDecoders.class)).isInstanceOf(RecordingTagDecoders.class);
                });
    }

    @Test
    void bindsReadLimitsFromProperties() {
        runner.withPropertyValues("tagprobe.read.max-upfront-bytes=4096", "tagprobe.read.max-wrap-depth=3")
                .run(context -> {
                    TagProbeProperties props = context.getBean(TagProbeProperties.class);
                    assertThat(props.maxUpfrontBytes()).isEqualTo(4096);
                    assertThat(props.maxWrapDepth()).isEqualTo(3);
                });
    }

    @Test
    void rejectsInvalidLimitsAtStartup() {
        runner.withPropertyValues("tagprobe.read.max-wrap-depth=1")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void technicalOnlyDecodersRecordRegionSize() {
        TagFields tags = new TechnicalOnlyTagDecoders().decodeId3v1(new ByteArraySeekableStream(new byte[128]));

        assertThat(tags.title()).isEmpty();
        assertThat(tags.raw()).containsEntry("id3v1_size", 128L);
        assertThat(new TechnicalOnlyTagDecoders().decodePicture(new ByteArraySeekableStream(new byte[4]))).isNull();
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(TagProbeProperties.class)
    static class PropertiesConfig {
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomDecoders {
        @Bean
        TagDecoders recordingDecoders() {
            return new RecordingTagDecoders();
        }
    }
}
