package io.invoiceops.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoiceops.ObjectStorageClient;
import io.invoiceops.ObjectStorageClientFactory;
import io.invoiceops.core.ConnectionTestResult;
import io.invoiceops.core.ErrorKind;
import io.invoiceops.core.JobCreation;
import io.invoiceops.core.JobDefinition;
import io.invoiceops.core.JobStatus;
import io.invoiceops.core.JobUpdate;
import io.invoiceops.core.ObjectStorageClients;
import io.invoiceops.core.RunStatus;
import io.invoiceops.core.SchedulerSettings;
import io.invoiceops.core.StorageCredentials;
import io.invoiceops.core.StorageProvider;
import io.invoiceops.core.ValidationCapabilityRegistry;
import io.invoiceops.crypto.AesGcmCredentialVault;
import io.invoiceops.exception.InvalidScheduleException;
import io.invoiceops.internal.InMemoryCronScheduler;
import io.invoiceops.model.JobRun;
import io.invoiceops.model.ScheduledValidationJob;
import io.invoiceops.testing.ExtensionValidator;
import io.invoiceops.testing.FakeObjectStorage;
import io.invoiceops.testing.InMemoryValidationJobStore;
import io.invoiceops.testing.MutableClock;
import io.invoiceops.testing.RecordingValidationHistory;
import io.invoiceops.utils.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduledValidationServiceTest {

    private static final String BUCKET = "invoices";
    private static final String OWNER = "owner-1";

    private final ObjectMapper objectMapper = Json.defaultMapper();
    private final AesGcmCredentialVault vault = new AesGcmCredentialVault("test-secret");
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T06:00:00Z"));

    private InMemoryValidationJobStore store;
    private FakeObjectStorage storage;
    private InMemoryCronScheduler scheduler;
    private ScheduledValidationService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryValidationJobStore();
        storage = new FakeObjectStorage(BUCKET);
        scheduler = new InMemoryCronScheduler(SchedulerSettings.defaults());
        service = newService(new ObjectStorageClients(List.of(storage)));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown(true);
    }

    @Test
    void createJobShouldPersistEncryptedCredentialsAndRegisterTimer() {
        JobCreation creation = service.createJob(definition("0 6 * * 1-5").build());

        assertTrue(creation.created());
        assertTrue(creation.connection().ok());
        ScheduledValidationJob job = creation.job();
        assertEquals(JobStatus.ACTIVE, job.getStatus());
        assertTrue(job.isEnabled());
        assertEquals("*.xml", job.getFilePattern());
        assertEquals("Europe/Berlin", job.getTimezone());
        assertFalse(job.getEncryptedCredentials().contains("AKIAEXAMPLE"));
        assertTrue(vault.decrypt(job.getEncryptedCredentials()).contains("AKIAEXAMPLE"));

        assertTrue(store.findJob(job.getId(), OWNER).isPresent());
        assertNotNull(service.nextRunAt(job.getId()));
        assertEquals(1, scheduler.getAllJobs().size());
    }

    @Test
    void createJobShouldStoreNothingWhenPreflightFails() {
        JobCreation creation = service.createJob(definition("0 6 * * *").bucketName("missing-bucket").build());

        assertFalse(creation.created());
        assertNull(creation.job());
        assertEquals(ErrorKind.NOT_FOUND, creation.connection().errorKind());
        assertTrue(service.listJobs(OWNER).isEmpty());
        assertTrue(scheduler.getAllJobs().isEmpty());
    }

    @Test
    void createJobShouldRejectInvalidSchedule() {
        assertThrows(InvalidScheduleException.class,
                () -> service.createJob(definition("0 6 * *").build()));
        assertThrows(InvalidScheduleException.class,
                () -> service.createJob(definition("0 6 * * *").timezone("Berlin/Nowhere").build()));

        assertTrue(service.listJobs(OWNER).isEmpty());
        assertEquals(0, storage.openClients());
    }

    @Test
    void testConnectionShouldReportUnsupportedProvider() {
        ConnectionTestResult result = service.testConnection(
                StorageProvider.GCS, StorageCredentials.ofS3("a", "b", null), BUCKET);

        assertFalse(result.ok());
        assertEquals(ErrorKind.UNSUPPORTED_PROVIDER, result.errorKind());
    }

    @Test
    void testConnectionShouldTurnUnexpectedErrorsIntoResult() {
        ObjectStorageClientFactory broken = new ObjectStorageClientFactory() {
            @Override
            public StorageProvider provider() {
                return StorageProvider.S3;
            }

            @Override
            public ObjectStorageClient open(StorageCredentials credentials) {
                throw new IllegalStateException("socket closed");
            }
        };
        ScheduledValidationService brokenService = newService(new ObjectStorageClients(List.of(broken)));

        ConnectionTestResult result = brokenService.testConnection(
                StorageProvider.S3, StorageCredentials.ofS3("a", "b", null), BUCKET);

        assertFalse(result.ok());
        assertEquals(ErrorKind.UNKNOWN, result.errorKind());
        assertEquals("Connection failed: socket closed", result.message());
    }

    @Test
    void disablingAndEnablingShouldToggleRegistration() {
        ScheduledValidationJob job = service.createJob(definition("0 6 * * *").build()).job();

        ScheduledValidationJob paused = service.updateJob(job.getId(), OWNER,
                JobUpdate.builder().enabled(false).build());
        assertEquals(JobStatus.PAUSED, paused.getStatus());
        assertTrue(scheduler.getAllJobs().isEmpty());
        assertNull(service.nextRunAt(job.getId()));

        ScheduledValidationJob active = service.updateJob(job.getId(), OWNER,
                JobUpdate.builder().enabled(true).cronExpression("30 7 * * *").build());
        assertEquals(JobStatus.ACTIVE, active.getStatus());
        assertEquals("30 7 * * *", scheduler.getAllJobs().get(0).cronExpression());
    }

    @Test
    void invalidScheduleUpdateShouldChangeNothing() {
        ScheduledValidationJob job = service.createJob(definition("0 6 * * *").build()).job();

        assertThrows(InvalidScheduleException.class, () -> service.updateJob(job.getId(), OWNER,
                JobUpdate.builder().name("renamed").cronExpression("99 * * * *").build()));

        ScheduledValidationJob stored = service.getJob(job.getId(), OWNER).orElseThrow();
        assertEquals("Nightly invoices", stored.getName());
        assertEquals("0 6 * * *", stored.getCronExpression());
        assertEquals("0 6 * * *", scheduler.getAllJobs().get(0).cronExpression());
    }

    @Test
    void nonScheduleUpdateShouldKeepStatus() {
        ScheduledValidationJob job = service.createJob(definition("0 6 * * *").build()).job();
        job.setStatus(JobStatus.ERROR);

        ScheduledValidationJob updated = service.updateJob(job.getId(), OWNER,
                JobUpdate.builder().moveToFolder("  ").webhookUrl("https://hooks.example.com/x").build());

        assertEquals(JobStatus.ERROR, updated.getStatus());
        assertNull(updated.getMoveToFolder());
        assertEquals("https://hooks.example.com/x", updated.getWebhookUrl());
    }

    @Test
    void updateOfForeignJobShouldFail() {
        ScheduledValidationJob job = service.createJob(definition("0 6 * * *").build()).job();

        assertThrows(IllegalArgumentException.class, () -> service.updateJob(job.getId(), "someone-else",
                JobUpdate.builder().name("x").build()));
    }

    @Test
    void deleteJobShouldRemoveTimerAndHistory() throws Exception {
        storage.put("in/a.xml", "<Invoice/>");
        scheduler.start();
        ScheduledValidationJob job = service.createJob(definition("0 6 * * *").build()).job();
        JobRun run = service.triggerRun(job.getId(), OWNER).get(10, TimeUnit.SECONDS);
        assertEquals(1, service.getRunFiles(run.getId()).size());

        assertFalse(service.deleteJob(job.getId(), "someone-else"));
        assertTrue(service.deleteJob(job.getId(), OWNER));

        assertTrue(scheduler.getAllJobs().isEmpty());
        assertTrue(service.getJob(job.getId(), OWNER).isEmpty());
        assertTrue(service.getRunFiles(run.getId()).isEmpty());
    }

    @Test
    void triggerRunShouldExecuteOnWorkerPool() throws Exception {
        storage.put("in/a.xml", "<Invoice/>").put("in/b.xml", "INVALID");
        scheduler.start();
        ScheduledValidationJob job = service.createJob(definition("0 6 * * *").build()).job();

        JobRun run = service.triggerRun(job.getId(), OWNER).get(10, TimeUnit.SECONDS);

        assertEquals(RunStatus.COMPLETED, run.getStatus());
        assertEquals(2, run.getFilesValidated());
        assertEquals(1, run.getFilesInvalid());
        assertEquals(List.of(run.getId()),
                service.getRuns(job.getId(), OWNER, 20).stream().map(JobRun::getId).toList());
    }

    @Test
    void triggerRunShouldRejectUnknownOrDisabledJobs() {
        ScheduledValidationJob job = service.createJob(definition("0 6 * * *").build()).job();
        service.updateJob(job.getId(), OWNER, JobUpdate.builder().enabled(false).build());

        assertThrows(IllegalArgumentException.class, () -> service.triggerRun("missing", OWNER));
        assertThrows(IllegalStateException.class, () -> service.triggerRun(job.getId(), OWNER));
    }

    @Test
    void getRunsShouldRejectNonPositiveLimit() {
        ScheduledValidationJob job = service.createJob(definition("0 6 * * *").build()).job();

        assertThrows(IllegalArgumentException.class, () -> service.getRuns(job.getId(), OWNER, 0));
    }

    @Test
    void registerEnabledJobsShouldSkipInvalidStoredSchedules() {
        ScheduledValidationJob good = service.createJob(definition("0 6 * * *").build()).job();
        ScheduledValidationJob broken = service.createJob(definition("0 7 * * *").build()).job();
        ScheduledValidationJob disabled = service.createJob(definition("0 8 * * *").build()).job();
        broken.setCronExpression("garbage");
        disabled.setEnabled(false);

        InMemoryCronScheduler fresh = new InMemoryCronScheduler(SchedulerSettings.defaults());
        ScheduledValidationService restarted = new ScheduledValidationService(store, fresh,
                newRunner(new ObjectStorageClients(List.of(storage))),
                new ObjectStorageClients(List.of(storage)), vault, objectMapper, clock);

        assertEquals(1, restarted.registerEnabledJobs());
        assertEquals(good.getId(), fresh.getAllJobs().get(0).jobId());
    }

    private JobDefinition.Builder definition(String cron) {
        return JobDefinition.builder()
                .ownerId(OWNER)
                .name("Nightly invoices")
                .provider(StorageProvider.S3)
                .credentials(StorageCredentials.ofS3("AKIAEXAMPLE", "secret", "eu-central-1"))
                .bucketName(BUCKET)
                .prefix("in/")
                .cronExpression(cron);
    }

    private ScheduledValidationService newService(ObjectStorageClients clients) {
        return new ScheduledValidationService(store, scheduler, newRunner(clients), clients, vault, objectMapper, clock);
    }

    private JobRunner newRunner(ObjectStorageClients clients) {
        return new JobRunner(
                store,
                vault,
                clients,
                new ValidationCapabilityRegistry(List.of(new ExtensionValidator("xml", "xrechnung"))),
                new RecordingValidationHistory(),
                null,
                objectMapper,
                clock
        );
    }
}
