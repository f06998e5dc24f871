package dev.pekelund.carereport.storage;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Wires the Cloud Storage backed pending report store when {@code care-report.storage.backend=gcs}.
 */
@Configuration
@EnableConfigurationProperties(GcsProperties.class)
@ConditionalOnProperty(value = "care-report.storage.backend", havingValue = "gcs")
public class GcsConfig {

    private static final Logger log = LoggerFactory.getLogger(GcsConfig.class);

    private final GcsProperties properties;
    private final ResourceLoader resourceLoader;

    public GcsConfig(GcsProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @Bean
    @ConditionalOnMissingBean
    public Storage storage() throws IOException {
        StorageOptions.Builder optionsBuilder = StorageOptions.newBuilder()
            .setCredentials(resolveCredentials());
        if (StringUtils.hasText(properties.getProjectId())) {
            optionsBuilder.setProjectId(properties.getProjectId());
        }
        return optionsBuilder.build().getService();
    }

    @Bean
    @ConditionalOnMissingBean(ReportBlobStore.class)
    public ReportBlobStore gcsReportBlobStore(Storage storage) {
        Assert.isTrue(StringUtils.hasText(properties.getBucket()),
            "gcs.bucket must be configured when care-report.storage.backend is gcs");
        log.info("Pending reports are stored in bucket {}", properties.getBucket());
        return new GcsReportBlobStore(storage, properties.getBucket());
    }

    private GoogleCredentials resolveCredentials() throws IOException {
        if (StringUtils.hasText(properties.getCredentials())) {
            Resource resource = resourceLoader.getResource(properties.getCredentials());
            if (resource.exists()) {
                try (InputStream inputStream = resource.getInputStream()) {
                    return GoogleCredentials.fromStream(inputStream);
                }
            }
            log.warn("GCS credentials resource {} not found; falling back to application default credentials.",
                properties.getCredentials());
        }
        return GoogleCredentials.getApplicationDefault();
    }
}
