/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.wind;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WindConfigTest {

    @Test
    @DisplayName("Defaults come from windgrid.properties")
    void defaults() {
        WindConfig config = WindConfig.defaults();

        assertEquals(250, config.binsPerBand());
        assertEquals(List.of("master", "heat", "gradient", "converge"), config.parameterTables());
        assertEquals(27, config.elements().size());
        assertEquals("H", config.elements().get(0));
        assertEquals("Co", config.elements().get(26));
        assertEquals("tables", config.fallbackDir());
        assertEquals("*xspec.*.txt", config.cellSpectraPattern());
        assertEquals(".sirocco-version", config.versionFile());
        assertSame(config, WindConfig.defaults());
    }

    @Test
    @DisplayName("with* methods copy without touching the defaults")
    void overrides() {
        WindConfig config = WindConfig.defaults().withBinsPerBand(10).withElements(List.of("C", "O"));

        assertEquals(10, config.binsPerBand());
        assertEquals(List.of("C", "O"), config.elements());
        assertEquals(250, WindConfig.defaults().binsPerBand());
        assertThrows(IllegalArgumentException.class, () -> WindConfig.defaults().withBinsPerBand(0));
    }
}
