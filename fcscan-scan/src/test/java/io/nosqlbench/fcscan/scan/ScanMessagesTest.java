package io.nosqlbench.fcscan.scan;

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

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class ScanMessagesTest {

    @Test
    void testMessagesUseDotDecimalsUnderAnyLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            assertEquals("(m=7.500, delta=3.000)", new GridPoint(7.5, 3.0).toString());
            assertEquals("1 of 8 fits did not converge (rate 0.1250 exceeds limit 0.0100)",
                new CalibrationException(1, 8, 0.01).getMessage());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
