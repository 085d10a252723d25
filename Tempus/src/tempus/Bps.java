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

import java.math.BigInteger;

/**
 * Basis-point and mul-div arithmetic on long amounts.
 * All divisions round down. Intermediate products never overflow; 
 *   results that do not fit a long are reported as Error.OVERFLOW.
 */
public class Bps {
    
    // amount * bps / 10000, rounded down
    public static long of(long amount, long bps) {
        return mulDivUnchecked(amount, bps, Main.MAX_BPS);
    }
    
    // a * b / c, rounded down
    public static long mulDiv(long a, long b, long c) throws LedgerException {
        if (c == 0)
            throw new LedgerException(Error.INVALID_AMOUNT, "division by zero");
        BigInteger r = BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)).divide(BigInteger.valueOf(c));
        if (r.bitLength() > 63)
            throw new LedgerException(Error.OVERFLOW, a + " * " + b + " / " + c);
        return r.longValue();
    }
    
    // For the bps case, where c >= b guarantees the result fits.
    static long mulDivUnchecked(long a, long b, long c) {
        return BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)).divide(BigInteger.valueOf(c)).longValue();
    }
    
    public static long mul(long a, long b) throws LedgerException {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new LedgerException(Error.OVERFLOW, e);
        }
    }
    
    public static long add(long a, long b) throws LedgerException {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new LedgerException(Error.OVERFLOW, e);
        }
    }
}
