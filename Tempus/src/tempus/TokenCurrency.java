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
 * A fungible token identified by its contract address.
 * 
 * Capture measures what actually arrived: tokens that charge a fee on 
 *   transfer (or otherwise deliver short) are rejected, since the ledger 
 *   would otherwise account for money it never received.
 */
public class TokenCurrency extends Currency {
    private static final long serialVersionUID = 1L;
    
    final String address;
    
    public TokenCurrency(String address) {
        if (address == null || address.trim().isEmpty())
            throw new IllegalArgumentException("token address is required");
        this.address = address.trim();
    }
    
    public String getAddress() { return address; }

    @Override
    public boolean isNative() {
        return false;
    }

    @Override
    public String getAssetKey() {
        return "token:" + address;
    }

    @Override
    public long capture(AssetBook book, long payer, long amount, long attachedValue) 
            throws LedgerException 
    {
        if (attachedValue != 0)
            throw new LedgerException(Error.INVALID_CAPTURE, "native value attached to a token payment");
        String asset = getAssetKey();
        long before = book.heldByLedger(asset);
        book.pull(asset, payer, amount);
        long received = book.heldByLedger(asset) - before;
        if (received < amount) {
            book.reversePull(asset, payer, amount);
            throw new LedgerException(Error.INVALID_CAPTURE, 
                    "received " + received + " of " + amount);
        }
        return received;
    }
}
