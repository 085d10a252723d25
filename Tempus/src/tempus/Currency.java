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
 * The asset the ledger is paid in: either the native asset or a single 
 *   fungible token. A value type; all state lives in the AssetBook that 
 *   each call is given.
 */
public abstract class Currency implements Serializable {
    private static final long serialVersionUID = 1L;
    
    public abstract boolean isNative();
    
    // Key of this asset in an AssetBook.
    public abstract String getAssetKey();
    
    // Pull exactly `amount` from `payer` into the ledger. `attachedValue` 
    //   is the native value that came attached to the call.
    // Returns the amount the ledger actually received (never less than 
    //   amount). On failure nothing has moved.
    public abstract long capture(AssetBook book, long payer, long amount, long attachedValue) 
            throws LedgerException;
    
    // Amount of this asset held by the ledger.
    public long balance(AssetBook book) {
        return book.heldByLedger(getAssetKey());
    }
    
    // Fail now if a transfer to `to` would fail later.
    public void checkTransfer(AssetBook book, long to) throws LedgerException {
        if (! book.canReceive(to))
            throw new LedgerException(Error.TRANSFER_FAILED, "account " + to + " cannot receive " + this);
    }
    
    // Push funds out; fails the operation if the receiver rejects them.
    public void transfer(AssetBook book, long to, long amount) throws LedgerException {
        if (! book.push(getAssetKey(), to, amount))
            throw new LedgerException(Error.TRANSFER_FAILED, "account " + to + " rejected " + amount + " " + this);
    }
    
    // Push funds out; reports rejection instead of failing.
    public boolean tryTransfer(AssetBook book, long to, long amount) {
        try {
            return book.push(getAssetKey(), to, amount);
        } catch (LedgerException e) {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return getAssetKey().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Currency))
            return false;
        return getAssetKey().equals(((Currency) obj).getAssetKey());
    }
    
    @Override
    public String toString() {
        return getAssetKey();
    }
}
