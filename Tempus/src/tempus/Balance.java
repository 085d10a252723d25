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

import java.io.Serializable;

/**
 * A mutable, non-negative amount of some asset.
 */
public class Balance implements Serializable {
    private static final long serialVersionUID = 1L;
    
    private long b;
    
    public Balance(long b) {
        this.b = b;
    }
    
    public long get() {
        return b;
    }
    
    public void credit(long amount) throws LedgerException {
        try {
            b = Math.addExact(b, amount);
        } catch (ArithmeticException e) {
            throw new LedgerException(Error.OVERFLOW, e);
        }
    }
    
    // caller checks that the balance covers the amount
    public void debit(long amount) {
        if (amount > b)
            throw new IllegalStateException("Balance " + b + " cannot cover debit of " + amount);
        b -= amount;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(b);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        return this.b == ((Balance) obj).b;
    }
    
    @Override
    public String toString() {
        return Long.toString(b);
    }
}
