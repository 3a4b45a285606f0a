package io.signaladvisor.analytics.breaks;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JenksNaturalBreaks}.
 */
@Tag("unit")
public class JenksNaturalBreaksTest {

    private static final double[] THREE_GROUPS = {21, 1, 11, 3, 20, 12, 2, 22, 10};

    @Test
    void separatesObviousGroups() {
        JenksNaturalBreaks jenks = new JenksNaturalBreaks(THREE_GROUPS, 4);

        assertArrayEquals(new double[]{1, 3, 12, 22}, jenks.breaks(3));
        assertArrayEquals(new double[]{3, 12}, jenks.interiorBreaks(3));
    }

    @Test
    void singleClassSpansRange() {
        JenksNaturalBreaks jenks = new JenksNaturalBreaks(THREE_GROUPS, 3);

        assertArrayEquals(new double[]{1, 22}, jenks.breaks(1));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5})
    void breaksAreAscendingAndBounded(int k) {
        JenksNaturalBreaks jenks = new JenksNaturalBreaks(THREE_GROUPS, 5);

        double[] breaks = jenks.breaks(k);

        assertEquals(k + 1, breaks.length);
        assertEquals(1.0, breaks[0]);
        assertEquals(22.0, breaks[k]);
        for (int i = 1; i < breaks.length; i++) {
            assertTrue(breaks[i] >= breaks[i - 1], "breaks not ascending for k=" + k);
        }
    }

    @Test
    void tiedValuesDoNotBreakBacktracking() {
        double[] data = {5, 5, 5, 5, 5, 5, 9};
        JenksNaturalBreaks jenks = new JenksNaturalBreaks(data, 4);

        for (int k = 1; k <= 4; k++) {
            double[] breaks = jenks.breaks(k);
            assertEquals(5.0, breaks[0]);
            assertEquals(9.0, breaks[k]);
        }
    }

    @Test
    void inputIsNotSortedInPlace() {
        double[] data = THREE_GROUPS.clone();

        new JenksNaturalBreaks(data, 3);

        assertArrayEquals(THREE_GROUPS, data);
    }

    @Test
    void sortedDataIsAscendingCopy() {
        JenksNaturalBreaks jenks = new JenksNaturalBreaks(THREE_GROUPS, 3);

        double[] sorted = jenks.sortedData();
        sorted[0] = 100;

        assertArrayEquals(new double[]{1, 2, 3, 10, 11, 12, 20, 21, 22}, jenks.sortedData());
        assertEquals(3, jenks.maxClasses());
    }

    @Test
    void rejectsOutOfRangeClassCounts() {
        JenksNaturalBreaks jenks = new JenksNaturalBreaks(THREE_GROUPS, 3);

        assertThrows(IllegalArgumentException.class, () -> jenks.breaks(0));
        assertThrows(IllegalArgumentException.class, () -> jenks.breaks(4));
        assertThrows(IllegalArgumentException.class, () -> new JenksNaturalBreaks(new double[]{1, 2}, 3));
    }
}
