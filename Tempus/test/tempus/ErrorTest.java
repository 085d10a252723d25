/*
 * Copyright (C) 2024 The Tempus Project
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package tempus;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorTest {

    @Test
    void codesMapToTheirKind() {
        assertThat(Error.kindOf(Error.OK)).isEqualTo(ErrorKind.NONE);
        assertThat(Error.kindOf(Error.INVALID_TIER_PARAMS)).isEqualTo(ErrorKind.VALIDATION);
        assertThat(Error.kindOf(Error.UNAUTHORIZED)).isEqualTo(ErrorKind.AUTHORIZATION);
        assertThat(Error.kindOf(Error.INVALID_CAPTURE)).isEqualTo(ErrorKind.INSUFFICIENT_FUNDS);
        assertThat(Error.kindOf(Error.GLOBAL_SUPPLY_EXCEEDED)).isEqualTo(ErrorKind.CAPACITY_EXCEEDED);
        assertThat(Error.kindOf(Error.DESTINATION_HAS_SUBSCRIPTION)).isEqualTo(ErrorKind.STATE_CONFLICT);
        assertThat(Error.kindOf(Error.NOT_FEE_RECIPIENT)).isEqualTo(ErrorKind.NOT_ELIGIBLE);
        assertThat(Error.kindOf(Error.EXCEPTION_NEVER_HAPPENS)).isEqualTo(ErrorKind.INTERNAL);
    }

    @Test
    void exceptionMessageNamesTheCode() {
        LedgerException e = new LedgerException(Error.TIER_PAUSED, "tier 3");

        assertThat(e.getMessage()).isEqualTo("TIER_PAUSED: tier 3");
        assertThat(Error.nameOf(Error.NOT_FEE_RECIPIENT)).isEqualTo("NOT_FEE_RECIPIENT");
        assertThat(Error.nameOf(Error.EXCEPTION_NEVER_HAPPENS)).isEqualTo("EXCEPTION_NEVER_HAPPENS");
        assertThat(Error.nameOf(-9999)).isEqualTo("ERROR_-9999");
    }

    @Test
    void bpsArithmeticRoundsDownAndRefusesOverflow() throws Exception {
        assertThat(Bps.of(999, 500)).isEqualTo(49);
        assertThat(Bps.mulDiv(Long.MAX_VALUE, 3, 4)).isEqualTo(Long.MAX_VALUE / 4 * 3 + 2);
        assertThatThrownBy(() -> Bps.mulDiv(Long.MAX_VALUE, 2, 1))
                .hasFieldOrPropertyWithValue("code", Error.OVERFLOW);
        assertThatThrownBy(() -> Bps.add(Long.MAX_VALUE, 1))
                .hasFieldOrPropertyWithValue("code", Error.OVERFLOW);
    }
}
