package com.fluxwatch.core.io;

import com.fluxwatch.core.model.LabeledInterval;
import com.fluxwatch.core.model.Observation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link KpiDatasetReader}.
 */
class KpiDatasetReaderTest {

    @Test
    @DisplayName("Should group rows by KPI and sort them by timestamp")
    void shouldGroupAndSort() throws Exception {
        Map<String, KpiSeries> dataset = KpiDatasetReader.read(resource("kpi-sample.csv"));

        assertThat(dataset).containsOnlyKeys("cpu", "disk");
        KpiSeries cpu = dataset.get("cpu");
        assertThat(cpu.getObservations())
                .extracting(Observation::getTimestamp)
                .containsExactly(60L, 120L, 180L, 240L, 300L);
        assertThat(cpu.getTrainLength()).isEqualTo(3);
        assertThat(dataset.get("disk").getTrainLength()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should mark missing rows as imputed observations")
    void shouldMarkMissingRows() throws Exception {
        KpiSeries cpu = KpiDatasetReader.read(resource("kpi-sample.csv")).get("cpu");

        assertThat(cpu.getObservations().get(2).isImputed()).isTrue();
        assertThat(cpu.getObservations().get(0).isImputed()).isFalse();
    }

    @Test
    @DisplayName("Should derive labelled intervals from the test segment only")
    void shouldDeriveTestIntervals() throws Exception {
        Map<String, KpiSeries> dataset = KpiDatasetReader.read(resource("kpi-sample.csv"));

        assertThat(dataset.get("cpu").getTestIntervals()).containsExactly(new LabeledInterval(240, 240));
        assertThat(dataset.get("disk").getTestIntervals()).containsExactly(new LabeledInterval(180, 180));
    }

    @Test
    @DisplayName("Should accept timestamps and flags written as floats")
    void shouldAcceptFloatNotation() throws IOException {
        String csv = "KPI ID,timestamp,value,label,missing,is_test\n"
                + "a,1.0,3.5,0.0,0.0,1.0\n";

        KpiSeries a = KpiDatasetReader.read(new StringReader(csv)).get("a");

        assertThat(a.getObservations()).containsExactly(new Observation(1, 3.5));
        assertThat(a.getTrainLength()).isZero();
    }

    @Test
    @DisplayName("Should reject a row with an unparsable value")
    void shouldRejectMalformedRow() {
        String csv = "timestamp,value,label,KPI ID,missing,is_test\n"
                + "1,2.0,0,a,0,0\n"
                + "2,abc,0,a,0,0\n";

        assertThatThrownBy(() -> KpiDatasetReader.read(new StringReader(csv)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed dataset row")
                .hasMessageContaining("abc");
    }

    @Test
    @DisplayName("Should reject a flag that is not 0 or 1")
    void shouldRejectBadFlag() {
        String csv = "timestamp,value,label,KPI ID,missing,is_test\n"
                + "1,2.0,maybe,a,0,0\n";

        assertThatThrownBy(() -> KpiDatasetReader.read(new StringReader(csv)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maybe");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(KpiDatasetReaderTest.class.getClassLoader().getResource(name).toURI());
    }
}
