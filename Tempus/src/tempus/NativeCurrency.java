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
 * The chain's native asset. Payments arrive as value attached to the call.
 */
public class NativeCurrency extends Currency {
    private static final long serialVersionUID = 1L;
    
    public static final String ASSET_KEY = "native";

    @Override
    public boolean isNative() {
        return true;
    }

    @Override
    public String getAssetKey() {
        return ASSET_KEY;
    }

    @Override
    public long capture(AssetBook book, long payer, long amount, long attachedValue) 
            throws LedgerException 
    {
        if (attachedValue != amount)
            throw new LedgerException(Error.INVALID_CAPTURE, 
                    "attached value " + attachedValue + " != amount " + amount);
        book.pull(ASSET_KEY, payer, amount);
        return amount;
    }
}
