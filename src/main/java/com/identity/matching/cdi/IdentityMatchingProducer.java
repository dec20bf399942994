package com.identity.matching.cdi;

import com.identity.matching.api.IdentityMatcher;
import com.identity.matching.api.MatchingOptions;
import com.identity.matching.directory.CachingDirectoryProvider;
import com.identity.matching.directory.DirectoryCacheConfig;
import com.identity.matching.directory.DirectoryProvider;
import com.identity.matching.directory.JsonApiDirectoryProvider;
import com.identity.matching.metrics.MetricsService;
import com.identity.matching.metrics.MicrometerMetricsService;
import com.identity.matching.metrics.NoOpMetricsService;
import com.identity.matching.nickname.NicknameDatasetLoader;
import com.identity.matching.nickname.NicknameIndex;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the identity matching library from MicroProfile Config properties.
 *
 * <pre>
 * identity-matching:
 *   matching:
 *     family-name-threshold: 0.90
 *     parallelism: 4
 *   directory:
 *     base-url: https://api.planningcenteronline.com
 *     access-token: ${PEOPLE_API_TOKEN}
 *   cache:
 *     ttl-seconds: 900
 *   nicknames:
 *     path: /etc/identity/nicknames.csv
 * </pre>
 *
 * <p>When a Micrometer {@link MeterRegistry} bean is available, metrics are recorded to it.</p>
 */
@ApplicationScoped
public class IdentityMatchingProducer {

    private static final Logger log = LoggerFactory.getLogger(IdentityMatchingProducer.class);

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-matching.matching.family-name-threshold", defaultValue = "0.90")
    double familyNameThreshold;

    @Inject
    @ConfigProperty(name = "identity-matching.matching.given-name-perfect-threshold", defaultValue = "0.95")
    double givenNamePerfectThreshold;

    @Inject
    @ConfigProperty(name = "identity-matching.matching.given-name-close-threshold", defaultValue = "0.85")
    double givenNameCloseThreshold;

    @Inject
    @ConfigProperty(name = "identity-matching.matching.full-name-perfect-threshold", defaultValue = "0.95")
    double fullNamePerfectThreshold;

    @Inject
    @ConfigProperty(name = "identity-matching.matching.full-name-close-threshold", defaultValue = "0.85")
    double fullNameCloseThreshold;

    @Inject
    @ConfigProperty(name = "identity-matching.matching.email-domain-threshold", defaultValue = "0.80")
    double emailDomainThreshold;

    @Inject
    @ConfigProperty(name = "identity-matching.matching.phone-suffix-length", defaultValue = "7")
    int phoneSuffixLength;

    @Inject
    @ConfigProperty(name = "identity-matching.matching.parallelism", defaultValue = "1")
    int parallelism;

    // ── Directory ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-matching.directory.base-url", defaultValue = "https://api.planningcenteronline.com")
    String directoryBaseUrl;

    @Inject
    @ConfigProperty(name = "identity-matching.directory.access-token")
    Optional<String> directoryAccessToken;

    @Inject
    @ConfigProperty(name = "identity-matching.directory.page-size", defaultValue = "100")
    int directoryPageSize;

    @Inject
    @ConfigProperty(name = "identity-matching.directory.max-pages", defaultValue = "100")
    int directoryMaxPages;

    @Inject
    @ConfigProperty(name = "identity-matching.directory.request-timeout-seconds", defaultValue = "30")
    int requestTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "identity-matching.directory.fetch-timeout-seconds", defaultValue = "300")
    int fetchTimeoutSeconds;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-matching.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "identity-matching.cache.max-size", defaultValue = "16")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "identity-matching.cache.ttl-seconds", defaultValue = "900")
    int cacheTtlSeconds;

    // ── Nicknames ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-matching.nicknames.path")
    Optional<String> nicknamesPath;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MatchingOptions matchingOptions() {
        return MatchingOptions.builder()
                .familyNameThreshold(familyNameThreshold)
                .givenNamePerfectThreshold(givenNamePerfectThreshold)
                .givenNameCloseThreshold(givenNameCloseThreshold)
                .fullNamePerfectThreshold(fullNamePerfectThreshold)
                .fullNameCloseThreshold(fullNameCloseThreshold)
                .emailDomainThreshold(emailDomainThreshold)
                .phoneSuffixLength(phoneSuffixLength)
                .directoryPageSize(directoryPageSize)
                .directoryMaxPages(directoryMaxPages)
                .fetchTimeout(Duration.ofSeconds(fetchTimeoutSeconds))
                .parallelism(parallelism)
                .build();
    }

    @Produces
    @ApplicationScoped
    public NicknameIndex nicknameIndex() {
        NicknameDatasetLoader loader = new NicknameDatasetLoader();
        return nicknamesPath
                .map(path -> loader.loadFromPath(Path.of(path)))
                .orElseGet(loader::loadDefault);
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Micrometer metrics enabled");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public IdentityMatcher identityMatcher(MatchingOptions options, NicknameIndex nicknameIndex,
                                           MetricsService metricsService) {
        log.info("Producing IdentityMatcher: {}", options);
        return IdentityMatcher.builder()
                .options(options)
                .nicknameIndex(nicknameIndex)
                .metricsService(metricsService)
                .build();
    }

    public void closeMatcher(@Disposes IdentityMatcher matcher) {
        log.info("Closing IdentityMatcher");
        matcher.close();
    }

    @Produces
    @ApplicationScoped
    public DirectoryProvider directoryProvider(MatchingOptions options, MetricsService metricsService) {
        JsonApiDirectoryProvider provider = JsonApiDirectoryProvider.builder()
                .baseUrl(directoryBaseUrl)
                .tokenSupplier(() -> directoryAccessToken.orElseThrow(() ->
                        new IllegalStateException("identity-matching.directory.access-token is not configured")))
                .options(options)
                .timeout(Duration.ofSeconds(requestTimeoutSeconds))
                .build();
        if (!cacheEnabled) {
            return provider;
        }
        return new CachingDirectoryProvider(provider,
                new DirectoryCacheConfig(cacheMaxSize, cacheTtlSeconds, true), metricsService);
    }
}
