package com.conveyal.velmap;

import com.conveyal.velmap.decomp.DecompositionMethod;
import com.conveyal.velmap.merge.MergeMode;
import com.conveyal.velmap.merge.OffsetMethod;
import com.conveyal.velmap.reference.ReferenceMethod;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VelmapConfigTest {

    private static Properties testProperties () throws IOException {
        Properties properties = new Properties();
        try (InputStream inputStream = VelmapConfigTest.class.getResourceAsStream("test-velmap.properties")) {
            properties.load(inputStream);
        }
        return properties;
    }

    @Test
    void loadsEveryOption () throws IOException {
        VelmapConfig config = new VelmapConfig(testProperties());

        assertTrue(config.useMask());
        assertEquals(MergeMode.MERGE, config.mergeAlongTrack());
        assertEquals(OffsetMethod.PLANAR, config.mergeAlongTrackMethod());
        assertFalse(config.mergeAcrossTrack());
        assertEquals(ReferenceMethod.POLYNOMIAL, config.referenceMethod());
        assertEquals(2, config.referencePolyOrder().intValue());
        // Blank optional values count as absent.
        assertNull(config.referenceFilterWindow());
        assertEquals(1.5, config.referenceNorthSigma().doubleValue());
        assertEquals(DecompositionMethod.TWO_STAGE, config.decompositionMethod());
        assertEquals(100, config.conditionThreshold());
        assertEquals(2, config.workerThreads());
    }

    @Test
    void missingOptionsAreNamed () throws IOException {
        Properties properties = testProperties();
        properties.remove("decomposition-method");
        properties.remove("use-mask");
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new VelmapConfig(properties));
        assertTrue(e.getMessage().contains("decomposition-method"));
        assertTrue(e.getMessage().contains("use-mask"));
    }

    @Test
    void malformedValuesAreRejected () throws IOException {
        Properties properties = testProperties();
        properties.setProperty("merge-along-track", "stitch");
        properties.setProperty("worker-threads", "-1");
        properties.setProperty("reference-poly-order", "two");
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new VelmapConfig(properties));
        assertTrue(e.getMessage().contains("merge-along-track"));
        assertTrue(e.getMessage().contains("worker-threads"));
        assertTrue(e.getMessage().contains("reference-poly-order"));
    }

    @Test
    void booleansAreStrict () throws IOException {
        Properties properties = testProperties();
        properties.setProperty("use-mask", "maybe");
        assertThrows(ConfigurationException.class, () -> new VelmapConfig(properties));
        properties.setProperty("use-mask", "no");
        assertFalse(new VelmapConfig(properties).useMask());
    }

    @Test
    void missingFileIsAConfigurationError () {
        assertThrows(ConfigurationException.class, () -> VelmapConfig.fromFile("no-such-velmap.properties"));
    }

}
