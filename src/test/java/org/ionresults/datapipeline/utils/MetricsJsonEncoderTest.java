package org.ionresults.datapipeline.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

@Tag("unit")
class MetricsJsonEncoderTest {

    @Test
    void keepsListOrderRatherThanAlphabeticalOrder() {
        String json = MetricsJsonEncoder.encode(List.of(
            new MetricField("spectral", new PlainValue.Real(0.5)),
            new MetricField("chaos", new PlainValue.Real(0.25)),
            new MetricField("b", new PlainValue.Integral(1)),
            new MetricField("a", new PlainValue.Integral(2))));

        assertThat(json).isEqualTo("{\"spectral\":0.5,\"chaos\":0.25,\"b\":1,\"a\":2}");
    }

    @Test
    void writesSequencesAndNulls() {
        String json = MetricsJsonEncoder.encode(List.of(
            new MetricField("ints", new PlainValue.Sequence(List.of(new PlainValue.Integral(100), new PlainValue.Integral(10)))),
            new MetricField("mixed", new PlainValue.Sequence(List.of(new PlainValue.Real(1.5), PlainValue.Null.INSTANCE))),
            new MetricField("missing", PlainValue.Null.INSTANCE)));

        assertThat(json).isEqualTo("{\"ints\":[100,10],\"mixed\":[1.5,null],\"missing\":null}");
    }

    @Test
    void outputIsValidJsonWithFullDoublePrecision() {
        double msm = 0.9 * 0.9 * 0.9;
        String json = MetricsJsonEncoder.encode(List.of(new MetricField("msm", new PlainValue.Real(msm))));

        JsonObject parsed = JsonParser.parseString(json).getAsJsonObject();
        assertThat(parsed.get("msm").getAsDouble()).isEqualTo(msm);
    }

    @Test
    void emptyBundleIsEmptyObject() {
        assertThat(MetricsJsonEncoder.encode(List.of())).isEqualTo("{}");
    }

    @Test
    void duplicateNamesAreRejected() {
        assertThatThrownBy(() -> MetricsJsonEncoder.encode(List.of(
                new MetricField("msm", new PlainValue.Real(0.1)),
                new MetricField("msm", new PlainValue.Real(0.2)))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void realsRejectNonFiniteValues() {
        assertThatThrownBy(() -> new PlainValue.Real(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}
