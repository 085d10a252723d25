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
import java.util.HashMap;
import java.util.HashSet;

/**
 * Holdings of the outside world in every asset the ledger can be paid in.
 * 
 * The ledger never calls out of its data model (the transaction journal 
 *   must replay to the same state), so the balances of the payers and 
 *   payees it deals with are kept here, next to the amount the ledger 
 *   itself holds. Assets are keyed by Currency.getAssetKey().
 * 
 * Two behaviors of real-world assets are reproduced because the ledger 
 *   has to survive them:
 * - fee-on-transfer tokens: a per-asset fee in basis points is burnt from 
 *   every transfer, so the receiver gets less than was sent;
 * - rejecting receivers: accounts flagged here make every incoming transfer 
 *   fail, like a recipient whose receive hook reverts.
 */
public class AssetBook implements Serializable {
    private static final long serialVersionUID = 1L;
    
    // asset key -> account -> balance
    HashMap<String, HashMap<Long, Balance>> holdings = new HashMap<>();
    
    // asset key -> amount held by the ledger
    HashMap<String, Balance> ledgerHoldings = new HashMap<>();
    
    // asset key -> amount destroyed by transfer fees
    HashMap<String, Balance> burnt = new HashMap<>();
    
    // asset key -> transfer fee in basis points
    HashMap<String, Integer> transferFeeBps = new HashMap<>();
    
    // accounts that refuse incoming transfers
    HashSet<Long> rejectingAccounts = new HashSet<>();
    
    //==================================================================
    
    private static Balance get(HashMap<String, Balance> map, String asset) {
        Balance balance = map.get(asset);
        if (balance == null) {
            balance = new Balance(0L);
            map.put(asset, balance);
        }
        return balance;
    }
    
    private Balance holding(String asset, long account) {
        HashMap<Long, Balance> accounts = holdings.get(asset);
        if (accounts == null) {
            accounts = new HashMap<>();
            holdings.put(asset, accounts);
        }
        Balance balance = accounts.get(account);
        if (balance == null) {
            balance = new Balance(0L);
            accounts.put(account, balance);
        }
        return balance;
    }
    
    long transferFee(String asset, long amount) {
        Integer bps = transferFeeBps.get(asset);
        if (bps == null || bps == 0)
            return 0;
        return Bps.of(amount, bps);
    }
    
    //==================================================================
    
    public long balanceOf(String asset, long account) {
        HashMap<Long, Balance> accounts = holdings.get(asset);
        if (accounts == null)
            return 0;
        Balance balance = accounts.get(account);
        return (balance == null) ? 0 : balance.get();
    }
    
    public long heldByLedger(String asset) {
        Balance balance = ledgerHoldings.get(asset);
        return (balance == null) ? 0 : balance.get();
    }

    public long burntBy(String asset) {
        Balance balance = burnt.get(asset);
        return (balance == null) ? 0 : balance.get();
    }
    
    public boolean canReceive(long account) {
        return (account != 0) && (! rejectingAccounts.contains(account));
    }
    
    void setRejecting(long account, boolean rejecting) {
        if (rejecting)
            rejectingAccounts.add(account);
        else
            rejectingAccounts.remove(account);
    }
    
    void setTransferFeeBps(String asset, int bps) throws LedgerException {
        if (bps < 0 || bps > Main.MAX_BPS)
            throw new LedgerException(Error.INVALID_AMOUNT, "transfer fee bps " + bps);
        transferFeeBps.put(asset, bps);
    }
    
    // Bring outside funds into an account (bridge-in / faucet).
    public void deposit(String asset, long account, long amount) throws LedgerException {
        if (account == 0)
            throw new LedgerException(Error.INVALID_ACCOUNT);
        if (amount <= 0)
            throw new LedgerException(Error.INVALID_AMOUNT);
        holding(asset, account).credit(amount);
    }
    
    // Move an amount from an outside account to the ledger. The ledger 
    //   receives the amount minus the asset's transfer fee.
    void pull(String asset, long from, long amount) throws LedgerException {
        if (amount == 0)
            return;
        if (balanceOf(asset, from) < amount)
            throw new LedgerException(Error.INSUFFICIENT_BALANCE, 
                    "account " + from + " holds " + balanceOf(asset, from) + ", needs " + amount);
        long fee = transferFee(asset, amount);
        get(ledgerHoldings, asset).credit(amount - fee);
        get(burnt, asset).credit(fee);
        holding(asset, from).debit(amount);
    }
    
    // Exactly undo a previous pull() of the same amount.
    void reversePull(String asset, long from, long amount) throws LedgerException {
        if (amount == 0)
            return;
        long fee = transferFee(asset, amount);
        get(ledgerHoldings, asset).debit(amount - fee);
        get(burnt, asset).debit(fee);
        holding(asset, from).credit(amount);
    }
    
    // Move an amount from the ledger to an outside account.
    // Returns false, changing nothing, if the receiver rejects it.
    boolean push(String asset, long to, long amount) throws LedgerException {
        if (! canReceive(to))
            return false;
        if (amount == 0)
            return true;
        if (heldByLedger(asset) < amount)
            throw new LedgerException(Error.INSUFFICIENT_BALANCE, 
                    "ledger holds " + heldByLedger(asset) + ", needs " + amount);
        long fee = transferFee(asset, amount);
        holding(asset, to).credit(amount - fee);
        get(burnt, asset).credit(fee);
        get(ledgerHoldings, asset).debit(amount);
        return true;
    }
}
