package com.sources.jobs.queue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sources.jobs.Job;
import com.sources.jobs.JobJson;

import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

/**
 * The dispatch envelope written to the durable queue: the job's name and its serialized payload.
 * {@code JobRaw} is base64 in the JSON form.
 */
public record JobRequest(@JsonProperty("JobName") String jobName, @JsonProperty("JobRaw") byte[] jobRaw) {

    public static JobRequest of(Job job) {
        Objects.requireNonNull(job, "job cannot be null");
        return new JobRequest(job.name(), job.serialize());
    }

    public static JobRequest fromBytes(byte[] json) throws IOException {
        return JobJson.MAPPER.readValue(json, JobRequest.class);
    }

    public byte[] toBytes() {
        return JobJson.toBytes(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobRequest that)) return false;
        return Objects.equals(jobName, that.jobName) && Arrays.equals(jobRaw, that.jobRaw);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(jobName) + Arrays.hashCode(jobRaw);
    }

    @Override
    public String toString() {
        return "JobRequest{jobName='" + jobName + "', jobRaw=" + (jobRaw == null ? 0 : jobRaw.length) + " bytes}";
    }
}
