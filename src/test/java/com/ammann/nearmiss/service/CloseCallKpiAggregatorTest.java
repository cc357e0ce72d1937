/* (C)2026 */
package com.ammann.nearmiss.service;

import static com.ammann.nearmiss.support.TestDataFactory.BASE;
import static com.ammann.nearmiss.support.TestDataFactory.closeCall;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.nearmiss.dto.CloseCallDTO;
import com.ammann.nearmiss.dto.NearMissRateDTO;
import com.ammann.nearmiss.dto.SeverityAnalysisDTO;
import com.ammann.nearmiss.dto.TimeSeriesPointDTO;
import com.ammann.nearmiss.dto.TopOffenderDTO;
import com.ammann.nearmiss.dto.ZoneAnalysisDTO;
import com.ammann.nearmiss.enumeration.Severity;
import com.ammann.nearmiss.service.CloseCallKpiAggregator.CloseCallKpis;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CloseCallKpiAggregatorTest {

    private static final long MINUTE = 60_000L;

    private final CloseCallKpiAggregator aggregator = new CloseCallKpiAggregator();

    @Nested
    @DisplayName("Time series")
    class TimeSeriesTests {

        @Test
        void bucketsByMinuteAscendingAndSparse() {
            List<CloseCallDTO> closeCalls =
                    List.of(
                            closeCall("v-1", 3 * MINUTE + 5_000, 1.0),
                            closeCall("v-1", 1_000, 1.0),
                            closeCall("v-2", 59_999, 1.0),
                            closeCall("v-2", 3 * MINUTE + 59_000, 1.0));

            List<TimeSeriesPointDTO> series = aggregator.timeSeries(closeCalls);

            assertThat(series)
                    .containsExactly(
                            new TimeSeriesPointDTO(BASE, 2),
                            new TimeSeriesPointDTO(BASE.plusMillis(3 * MINUTE), 2));
        }
    }

    @Nested
    @DisplayName("Top offenders")
    class TopOffenderTests {

        @Test
        void ratePerMinuteUsesDistinctExposureMinutes() {
            List<CloseCallDTO> closeCalls =
                    List.of(
                            closeCall("v-1", 0, 1.0),
                            closeCall("v-1", 10_000, 1.0),
                            closeCall("v-1", MINUTE, 1.0),
                            closeCall("v-1", MINUTE + 30_000, 1.0),
                            closeCall("v-1", 5 * MINUTE, 1.0),
                            closeCall("v-2", 0, 1.0));

            List<TopOffenderDTO> offenders = aggregator.topOffenders(closeCalls);

            assertThat(offenders).hasSize(2);
            assertThat(offenders.get(0)).isEqualTo(new TopOffenderDTO("v-1", 5, 3, 1.667));
            assertThat(offenders.get(1)).isEqualTo(new TopOffenderDTO("v-2", 1, 1, 1.0));
        }

        @Test
        void keepsTenBestAndBreaksTiesByVehicleId() {
            List<CloseCallDTO> closeCalls = new ArrayList<>();
            for (int v = 0; v < 12; v++) {
                int count = v < 3 ? 5 : 2;
                for (int i = 0; i < count; i++) {
                    closeCalls.add(closeCall(String.format("v-%02d", v), i * 1_000L, 1.0));
                }
            }
            Collections.reverse(closeCalls);

            List<TopOffenderDTO> offenders = aggregator.topOffenders(closeCalls);

            assertThat(offenders).hasSize(10);
            assertThat(offenders)
                    .extracting(TopOffenderDTO::vehicleId)
                    .startsWith("v-00", "v-01", "v-02", "v-03")
                    .doesNotContain("v-10", "v-11");
        }
    }

    @Nested
    @DisplayName("Zone analysis")
    class ZoneTests {

        @Test
        void groupsByVehicleZoneThenHumanZone() {
            List<CloseCallDTO> closeCalls =
                    List.of(
                            closeCall("v-1", 0, 0.5, "dock", "aisle"),
                            closeCall("v-1", 0, 1.5, "dock", null),
                            closeCall("v-2", 0, 1.2, null, "aisle"),
                            closeCall("v-3", 0, 1.9, null, null));

            ZoneAnalysisDTO analysis = aggregator.zoneAnalysis(closeCalls);

            assertThat(analysis.worstZone()).isEqualTo("dock");
            assertThat(analysis.byZone()).containsOnlyKeys("aisle", "dock");
            assertThat(analysis.byZone().get("dock").closeCalls()).isEqualTo(2);
            assertThat(analysis.byZone().get("dock").avgDistance()).isEqualTo(1.0);
            assertThat(analysis.byZone().get("dock").minDistance()).isEqualTo(0.5);
            assertThat(analysis.byZone().get("dock").maxDistance()).isEqualTo(1.5);
            assertThat(analysis.byZone().get("aisle").closeCalls()).isEqualTo(1);
        }

        @Test
        void tiesGoToSmallestZoneIdRegardlessOfInputOrder() {
            List<CloseCallDTO> closeCalls =
                    new ArrayList<>(
                            List.of(
                                    closeCall("v-1", 0, 1.0, "zone-b", null),
                                    closeCall("v-1", 0, 1.0, "zone-b", null),
                                    closeCall("v-2", 0, 1.0, "zone-a", null),
                                    closeCall("v-2", 0, 1.0, "zone-a", null)));

            ZoneAnalysisDTO forward = aggregator.zoneAnalysis(closeCalls);
            Collections.reverse(closeCalls);
            ZoneAnalysisDTO reversed = aggregator.zoneAnalysis(closeCalls);

            assertThat(forward.worstZone()).isEqualTo("zone-a");
            assertThat(reversed.worstZone()).isEqualTo("zone-a");
            assertThat(forward.byZone().keySet()).containsExactly("zone-a", "zone-b");
        }

        @Test
        void noZonesYieldsEmptyAnalysis() {
            ZoneAnalysisDTO analysis = aggregator.zoneAnalysis(List.of(closeCall("v-1", 0, 1.0)));

            assertThat(analysis.worstZone()).isNull();
            assertThat(analysis.byZone()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Near-miss rate")
    class NearMissRateTests {

        @Test
        void normalizesPerHundredVehicleMinutes() {
            List<CloseCallDTO> closeCalls =
                    List.of(
                            closeCall("v-1", 0, 1.0),
                            closeCall("v-1", 1_000, 1.0),
                            closeCall("v-2", 2_000, 1.0));

            NearMissRateDTO rate =
                    aggregator.nearMissRate(closeCalls, BASE, BASE.plusMillis(60 * MINUTE));

            assertThat(rate.uniqueVehicles()).isEqualTo(2);
            assertThat(rate.observationMinutes()).isEqualTo(60.0);
            assertThat(rate.totalVehicleMinutes()).isEqualTo(120.0);
            assertThat(rate.ratePer100Minutes()).isEqualTo(2.5);
        }

        @Test
        void derivesWindowFromCloseCallSpanWithoutBounds() {
            List<CloseCallDTO> closeCalls =
                    List.of(closeCall("v-1", 0, 1.0), closeCall("v-1", 30 * MINUTE, 1.0));

            NearMissRateDTO rate = aggregator.nearMissRate(closeCalls, null, null);

            assertThat(rate.observationMinutes()).isEqualTo(30.0);
            assertThat(rate.ratePer100Minutes()).isEqualTo(6.67);
        }

        @Test
        void fallsBackToDefaultWindowForSingleInstant() {
            NearMissRateDTO rate = aggregator.nearMissRate(List.of(closeCall("v-1", 0, 1.0)), BASE, null);

            assertThat(rate.observationMinutes()).isEqualTo(60.0);
            assertThat(rate.ratePer100Minutes()).isEqualTo(1.67);
        }

        @Test
        void emptyListHasZeroRate() {
            Instant to = BASE.plusMillis(15 * MINUTE);

            NearMissRateDTO rate = aggregator.nearMissRate(List.of(), BASE, to);

            assertThat(rate.ratePer100Minutes()).isZero();
            assertThat(rate.totalVehicleMinutes()).isZero();
            assertThat(rate.uniqueVehicles()).isZero();
            assertThat(rate.observationMinutes()).isEqualTo(15.0);
        }
    }

    @Nested
    @DisplayName("Severity analysis")
    class SeverityTests {

        @Test
        void reportsCountShareAndMeanPerTier() {
            List<CloseCallDTO> closeCalls =
                    List.of(
                            closeCall("v-1", 0, 0.4),
                            closeCall("v-1", 0, 0.6),
                            closeCall("v-1", 0, 1.2),
                            closeCall("v-1", 0, 1.9));

            SeverityAnalysisDTO analysis = aggregator.severityAnalysis(closeCalls);

            assertThat(analysis.get(Severity.HIGH).count()).isEqualTo(2);
            assertThat(analysis.get(Severity.HIGH).percentage()).isEqualTo(50.0);
            assertThat(analysis.get(Severity.HIGH).avgDistance()).isEqualTo(0.5);
            assertThat(analysis.get(Severity.MEDIUM).count()).isEqualTo(1);
            assertThat(analysis.get(Severity.MEDIUM).percentage()).isEqualTo(25.0);
            assertThat(analysis.get(Severity.LOW).avgDistance()).isEqualTo(1.9);
        }

        @Test
        void percentagesRoundToOneDecimal() {
            List<CloseCallDTO> closeCalls =
                    List.of(closeCall("v-1", 0, 0.4), closeCall("v-1", 0, 1.6), closeCall("v-1", 0, 1.7));

            SeverityAnalysisDTO analysis = aggregator.severityAnalysis(closeCalls);

            assertThat(analysis.high().percentage()).isEqualTo(33.3);
            assertThat(analysis.low().percentage()).isEqualTo(66.7);
            assertThat(analysis.medium().percentage()).isZero();
            assertThat(analysis.medium().avgDistance()).isZero();
        }
    }

    @Test
    void emptyInputYieldsZeroValuedStructures() {
        CloseCallKpis kpis = aggregator.aggregate(List.of(), null, null);

        assertThat(kpis.timeSeries()).isEmpty();
        assertThat(kpis.topOffenders()).isEmpty();
        assertThat(kpis.zoneAnalysis()).isEqualTo(ZoneAnalysisDTO.empty());
        assertThat(kpis.nearMissRate().ratePer100Minutes()).isZero();
        assertThat(kpis.severityAnalysis()).isEqualTo(SeverityAnalysisDTO.empty());
        assertThat(kpis.severityAnalysis().high()).isNotNull();
    }

    @Test
    void roundingGuardsNonFiniteValues() {
        assertThat(CloseCallKpiAggregator.round(Double.NaN, 2)).isZero();
        assertThat(CloseCallKpiAggregator.round(Double.POSITIVE_INFINITY, 2)).isZero();
        assertThat(CloseCallKpiAggregator.round(1.6666, 3)).isEqualTo(1.667);
    }
}
