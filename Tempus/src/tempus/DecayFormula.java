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

/**
 * How a reward curve's multiplier steps down, one step per elapsed period.
 */
public enum DecayFormula {
    
    // base ^ (periods left)
    EXPONENTIAL,
    
    // base * (periods left)
    LINEAR;
    
    long multiplier(long base, long periodsLeft) throws LedgerException {
        switch (this) {
            case EXPONENTIAL: {
                long m = 1;
                for (long i = 0; i < periodsLeft; ++i)
                    m = Bps.mul(m, base);
                return m;
            }
            case LINEAR:
                return Bps.mul(base, periodsLeft);
            default:
                throw new LedgerException(Error.NEVER_HAPPENS);
        }
    }
}
