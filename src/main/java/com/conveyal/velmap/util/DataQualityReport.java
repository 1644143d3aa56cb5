package com.conveyal.velmap.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the DataQualityWarnings raised during one pipeline run. Stages processing frames or tracks on several
 * worker threads share one instance, so all access is synchronized. Each warning is also logged when it is recorded.
 */
public class DataQualityReport {

    private static final Logger LOG = LoggerFactory.getLogger(DataQualityReport.class);

    private final List<DataQualityWarning> warnings = new ArrayList<>();

    public void warn (DataQualityWarning.Type type, String subject, String message) {
        DataQualityWarning warning = new DataQualityWarning(type, subject, message);
        LOG.warn("{}", warning);
        synchronized (warnings) {
            warnings.add(warning);
        }
    }

    /** @return a snapshot of the warnings recorded so far, in the order they were recorded. */
    public List<DataQualityWarning> getWarnings () {
        synchronized (warnings) {
            return new ArrayList<>(warnings);
        }
    }

    public int count (DataQualityWarning.Type type) {
        synchronized (warnings) {
            return (int) warnings.stream().filter(w -> w.type == type).count();
        }
    }

    public boolean isEmpty () {
        synchronized (warnings) {
            return warnings.isEmpty();
        }
    }

    public void writeJson (OutputStream outputStream) throws IOException {
        JsonUtil.objectMapper.writeValue(outputStream, getWarnings());
    }

}
