/***********************************************************************
 * This file is part of Monocle Gateway.
 *
 * Monocle Gateway is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Monocle Gateway is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Monocle Gateway.  If not, see <http://www.gnu.org/licenses/>.
 ************************************************************************/

package org.monocle.gateway.web;

import org.junit.Test;

import java.util.Locale;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class ControlCommandParserTest {

    private static void assertMalformed(String command) {
        try {
            ControlCommandParser.parse(command);
            fail("Expected \"" + command + "\" to be rejected");
        } catch (MalformedCommandException e) {
            assertEquals(command, e.getCommand());
        }
    }

    @Test
    public void commands() throws Exception {
        assertEquals(ControlIntent.stop(), ControlCommandParser.parse("stop"));
        assertEquals(ControlIntent.home(), ControlCommandParser.parse("home"));
        assertEquals(ControlIntent.preset("Door"), ControlCommandParser.parse("preset:Door"));
        assertEquals(ControlIntent.ptz(1, -2, 0), ControlCommandParser.parse("ptz:1:-2:0"));
        assertEquals(ControlIntent.pan(-3), ControlCommandParser.parse("pan:-3"));
        assertEquals(ControlIntent.tilt(2), ControlCommandParser.parse("tilt:2"));
        assertEquals(ControlIntent.zoom(1), ControlCommandParser.parse("zoom:1"));
    }

    @Test
    public void keywordCaseAndWhitespaceIgnored() throws Exception {
        assertEquals(ControlIntent.stop(), ControlCommandParser.parse("  STOP\n"));
        assertEquals(ControlIntent.pan(2), ControlCommandParser.parse("Pan: 2"));
        assertEquals(ControlIntent.preset("MixedCase"), ControlCommandParser.parse("PRESET:MixedCase"));
    }

    @Test
    public void keywordMatchingIgnoresDefaultLocale() throws Exception {
        final Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(ControlIntent.tilt(1), ControlCommandParser.parse("TILT:1"));
            assertEquals(ControlIntent.preset("Inside"), ControlCommandParser.parse("PRESET:Inside"));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    public void presetTokenKeepsColonsAndIndexes() throws Exception {
        assertEquals(ControlIntent.preset("a:b"), ControlCommandParser.parse("preset:a:b"));
        assertEquals(ControlIntent.preset("#2"), ControlCommandParser.parse("preset:#2"));
    }

    @Test
    public void outOfRangeLevelsStillParse() throws Exception {
        assertEquals(ControlIntent.pan(9), ControlCommandParser.parse("pan:9"));
    }

    @Test
    public void insufficientArity() {
        assertMalformed("ptz:1:2");
        assertMalformed("pan");
        assertMalformed("preset");
        assertMalformed("preset:");
    }

    @Test
    public void nonIntegerLevels() {
        assertMalformed("pan:fast");
        assertMalformed("ptz:1:x:0");
        assertMalformed("zoom:1.5");
        assertMalformed("tilt:");
    }

    @Test
    public void unknownCommands() {
        assertMalformed("dance");
        assertMalformed("");
        assertMalformed("   ");
    }
}
