package io.invoiceops.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoiceops.CredentialVault;
import io.invoiceops.CronScheduler;
import io.invoiceops.ObjectStorageClientFactory;
import io.invoiceops.ValidationCapability;
import io.invoiceops.ValidationHistory;
import io.invoiceops.core.ObjectStorageClients;
import io.invoiceops.core.ValidationCapabilityRegistry;
import io.invoiceops.crypto.AesGcmCredentialVault;
import io.invoiceops.internal.InMemoryCronScheduler;
import io.invoiceops.internal.mongo.MongoDeliveryStore;
import io.invoiceops.internal.mongo.MongoValidationJobStore;
import io.invoiceops.internal.s3.S3ObjectStorageClientFactory;
import io.invoiceops.runner.JobRunner;
import io.invoiceops.runner.ScheduledValidationService;
import io.invoiceops.store.DeliveryStore;
import io.invoiceops.store.ValidationJobStore;
import io.invoiceops.utils.Json;
import io.invoiceops.webhook.DeliveryEngine;
import io.invoiceops.webhook.RetrySweeper;
import io.invoiceops.webhook.WebhookService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Boot auto-configuration entrypoint for scheduled validations and webhook delivery.
 *
 * <p>The host application supplies a {@link ValidationHistory} and its {@link ValidationCapability} beans;
 * everything else has a default that backs off when a bean of the same type exists.
 */
@AutoConfiguration
@ConditionalOnClass({ScheduledValidationService.class, MongoTemplate.class})
@EnableConfigurationProperties(InvoiceOpsProperties.class)
@ConditionalOnProperty(prefix = "invoiceops", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InvoiceOpsConfig {

    public static final String DELIVERY_EXECUTOR = "invoiceOpsDeliveryExecutor";

    @Bean
    @ConditionalOnMissingBean
    public Clock invoiceOpsClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper invoiceOpsObjectMapper() {
        return Json.defaultMapper();
    }

    @Bean
    @ConditionalOnMissingBean(ValidationJobStore.class)
    protected MongoValidationJobStore mongoValidationJobStore(MongoTemplate mongoTemplate) {
        return new MongoValidationJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(DeliveryStore.class)
    protected MongoDeliveryStore mongoDeliveryStore(MongoTemplate mongoTemplate) {
        return new MongoDeliveryStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected InvoiceOpsMongoIndexConfig invoiceOpsMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new InvoiceOpsMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialVault credentialVault(InvoiceOpsProperties props) {
        return new AesGcmCredentialVault(props.getCredentialSecret());
    }

    @Bean
    @ConditionalOnMissingBean
    public S3ObjectStorageClientFactory s3ObjectStorageClientFactory(InvoiceOpsProperties props) {
        return new S3ObjectStorageClientFactory(props.getS3().toSettings());
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectStorageClients objectStorageClients(ObjectProvider<List<ObjectStorageClientFactory>> factoriesProvider) {
        return new ObjectStorageClients(factoriesProvider.getIfAvailable(List::of));
    }

    @Bean
    @ConditionalOnMissingBean
    public ValidationCapabilityRegistry validationCapabilityRegistry(
            ObjectProvider<List<ValidationCapability>> capabilitiesProvider) {
        return new ValidationCapabilityRegistry(capabilitiesProvider.getIfAvailable(List::of));
    }

    @Bean
    @ConditionalOnMissingBean
    public CronScheduler cronScheduler(InvoiceOpsProperties props, Clock clock) {
        return new InMemoryCronScheduler(props.getScheduler().toSettings(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpClient invoiceOpsHttpClient(InvoiceOpsProperties props) {
        return HttpClient.newBuilder()
                .connectTimeout(props.getWebhook().getRequestTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Bean(name = DELIVERY_EXECUTOR, destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = DELIVERY_EXECUTOR)
    public ExecutorService invoiceOpsDeliveryExecutor(InvoiceOpsProperties props) {
        AtomicInteger threadCount = new AtomicInteger();
        return Executors.newFixedThreadPool(props.getWebhook().getDeliveryThreads(), r -> {
            Thread t = new Thread(r);
            t.setName("invoiceops.webhook.delivery-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryEngine deliveryEngine(DeliveryStore deliveryStore, HttpClient httpClient,
                                         InvoiceOpsProperties props, Clock clock) {
        return new DeliveryEngine(deliveryStore, httpClient, props.getWebhook().toSettings(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookService webhookService(DeliveryStore deliveryStore, DeliveryEngine deliveryEngine,
                                         @Qualifier(DELIVERY_EXECUTOR) ExecutorService deliveryExecutor,
                                         ObjectMapper objectMapper, Clock clock) {
        return new WebhookService(deliveryStore, deliveryEngine, deliveryExecutor, objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetrySweeper retrySweeper(DeliveryEngine deliveryEngine, InvoiceOpsProperties props) {
        return new RetrySweeper(deliveryEngine, props.getWebhook().getRetrySweepInterval(),
                props.getWebhook().getRetryBatchSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRunner jobRunner(ValidationJobStore jobStore, CredentialVault credentialVault,
                               ObjectStorageClients storageClients, ValidationCapabilityRegistry capabilities,
                               ValidationHistory validationHistory, WebhookService webhookService,
                               ObjectMapper objectMapper, Clock clock) {
        return new JobRunner(jobStore, credentialVault, storageClients, capabilities, validationHistory,
                webhookService, objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduledValidationService scheduledValidationService(ValidationJobStore jobStore, CronScheduler scheduler,
                                                                 JobRunner jobRunner, ObjectStorageClients storageClients,
                                                                 CredentialVault credentialVault,
                                                                 ObjectMapper objectMapper, Clock clock) {
        return new ScheduledValidationService(jobStore, scheduler, jobRunner, storageClients, credentialVault,
                objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public InvoiceOpsLifecycle invoiceOpsLifecycle(CronScheduler scheduler,
                                                   ScheduledValidationService validationService,
                                                   RetrySweeper retrySweeper) {
        return new InvoiceOpsLifecycle(scheduler, validationService, retrySweeper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "invoiceops", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton invoiceOpsIndexesInitializer(InvoiceOpsMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
