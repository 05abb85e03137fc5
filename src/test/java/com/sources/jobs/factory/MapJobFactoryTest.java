package com.sources.jobs.factory;

import com.sources.jobs.FatalJobException;
import com.sources.jobs.Job;
import com.sources.jobs.jobs.AsyncDestroyJob;
import com.sources.jobs.jobs.SuperkeyDestroyJob;
import com.sources.jobs.model.ForwardableHeader;
import com.sources.jobs.queue.JobRequest;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MapJobFactoryTest {

    private static final List<ForwardableHeader> HEADERS = List.of(
            new ForwardableHeader(ForwardableHeader.ORG_ID, "org-1"),
            new ForwardableHeader(ForwardableHeader.IDENTITY, "eyJpZGVudGl0eSI6e319"));

    private final MapJobFactory factory = MapJobFactory.withDefaultJobs();

    @Test
    void registersBothQueueableJobs() {
        assertThat(factory.registeredNames()).containsExactlyInAnyOrder("SuperkeyDestroyJob", "AsyncDestroyJob");
    }

    @Test
    void rebuildsEveryRegisteredJobFromItsEnvelope() throws Exception {
        List<Job> jobs = List.of(
                SuperkeyDestroyJob.forSource(HEADERS, "identity", 10L, 20L),
                SuperkeyDestroyJob.forApplication(HEADERS, "identity", 10L, 30L),
                new AsyncDestroyJob(HEADERS, 10L, 15, "application", 30L));

        for (Job job : jobs) {
            JobRequest request = JobRequest.fromBytes(JobRequest.of(job).toBytes());

            assertThat(request.jobName()).isEqualTo(job.name());
            assertThat(factory.create(request.jobName(), request.jobRaw())).isEqualTo(job);
        }
    }

    @Test
    void asyncDestroyPayloadUsesSnakeCaseWait() {
        String json = new String(new AsyncDestroyJob(HEADERS, 1L, 15, "source", 2L).serialize(), StandardCharsets.UTF_8);

        assertThat(json).contains("\"wait_seconds\":15").contains("\"model\":\"source\"").contains("\"tenant\":1");
    }

    @Test
    void envelopeUsesJobNameAndJobRawKeys() {
        String json = new String(new JobRequest("AsyncDestroyJob", new byte[]{1, 2}).toBytes(), StandardCharsets.UTF_8);

        assertThat(json).contains("\"JobName\":\"AsyncDestroyJob\"").contains("\"JobRaw\":\"AQI=\"");
    }

    @Test
    void unknownNameIsFatal() {
        assertThatThrownBy(() -> factory.create("NoSuchJob", "{}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(FatalJobException.class)
                .hasMessageContaining("NoSuchJob");
    }

    @Test
    void malformedPayloadIsFatal() {
        assertThatThrownBy(() -> factory.create(AsyncDestroyJob.NAME, "not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(FatalJobException.class)
                .hasCauseInstanceOf(java.io.IOException.class);
    }

    @Test
    void rejectsBlankNamesAndMissingDeserializers() {
        assertThatThrownBy(() -> factory.register(" ", raw -> null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> factory.register("Job", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void customRegistrationsAreUsed() throws Exception {
        AsyncDestroyJob fixed = new AsyncDestroyJob(List.of(), 1L, 0, "source", 1L);
        factory.register("Fixed", raw -> fixed);

        assertThat(factory.create("Fixed", new byte[0])).isSameAs(fixed);
    }
}
