package com.sources.jobs.factory;

import com.sources.jobs.Job;

import java.io.IOException;

/**
 * Decodes one job variant from its serialized payload.
 */
@FunctionalInterface
public interface JobDeserializer {

    Job deserialize(byte[] raw) throws IOException;
}
