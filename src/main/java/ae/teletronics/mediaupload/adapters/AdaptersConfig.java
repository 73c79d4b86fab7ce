package ae.teletronics.mediaupload.adapters;

import ae.teletronics.mediaupload.adapters.detection.TikaFileTypeDetector;
import ae.teletronics.mediaupload.adapters.time.SystemClockProvider;
import ae.teletronics.mediaupload.adapters.transport.WebClientUploadTransport;
import ae.teletronics.mediaupload.application.GalleryCache;
import ae.teletronics.mediaupload.domain.model.UploadConfiguration;
import ae.teletronics.mediaupload.ports.ClockProvider;
import ae.teletronics.mediaupload.ports.FileTypeDetector;
import ae.teletronics.mediaupload.ports.UploadTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Set;

@Configuration
@Profile("!test")
public class AdaptersConfig {

    @Bean
    @ConditionalOnMissingBean(UploadConfiguration.class)
    public UploadConfiguration uploadConfiguration(
            @Value("${media.upload.endpoint-url}") String endpointUrl,
            @Value("${media.upload.max-file-size-bytes:5242880}") long maxFileSizeBytes,
            @Value("${media.upload.allowed-mime-types:image/jpeg,image/jpg,image/png,image/gif,image/webp}") Set<String> allowedMimeTypes,
            @Value("${media.upload.upload-timeout-ms:30000}") long uploadTimeoutMs,
            @Value("${media.upload.max-concurrent-uploads:3}") int maxConcurrentUploads,
            @Value("${media.upload.gallery-timeout-ms:15000}") long galleryTimeoutMs,
            @Value("${media.upload.gallery-cache-ttl-ms:300000}") long galleryCacheTtlMs
    ) {
        return new UploadConfiguration(endpointUrl, maxFileSizeBytes, allowedMimeTypes,
                uploadTimeoutMs, maxConcurrentUploads, galleryTimeoutMs, galleryCacheTtlMs);
    }

    @Bean
    @ConditionalOnMissingBean(UploadTransport.class)
    public UploadTransport uploadTransport(
            WebClient.Builder webClientBuilder,
            @Value("${media.upload.max-response-bytes:1048576}") int maxResponseBytes
    ) {
        WebClient webClient = webClientBuilder
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxResponseBytes))
                .build();
        return new WebClientUploadTransport(webClient);
    }

    @Bean
    public GalleryCache galleryCache(UploadTransport transport,
                                     ClockProvider clock,
                                     ObjectMapper objectMapper,
                                     @Value("${media.gallery.cache-capacity:50}") int capacity) {
        return new GalleryCache(transport, clock, objectMapper, capacity);
    }

    @Bean
    @ConditionalOnMissingBean(FileTypeDetector.class)
    public FileTypeDetector fileTypeDetector() {
        return new TikaFileTypeDetector();
    }

    @Bean
    @ConditionalOnMissingBean(ClockProvider.class)
    public ClockProvider clockProvider() {
        return new SystemClockProvider();
    }
}
