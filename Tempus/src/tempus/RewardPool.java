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
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;

/**
 * Share-based reward pool.
 * 
 * Holders own shares; allocations raise the value of every share alike. 
 *   Accounting is points-per-share: each allocation adds 
 *   amount * MAGNITUDE / totalShares to pointsPerShare, and a holder is 
 *   entitled to (pointsPerShare * numShares + correction) / MAGNITUDE 
 *   minus what it already withdrew. The correction makes newly issued 
 *   shares start at zero, so issuing never dilutes earlier allocations.
 *   All divisions round down and the residue stays in the pool.
 * 
 * The pool balance is allocations minus payouts. sum(numShares) is 
 *   always totalShares.
 */
public class RewardPool implements Serializable {
    private static final long serialVersionUID = 1L;
    
    static final BigInteger MAGNITUDE = BigInteger.ONE.shiftLeft(128);
    
    // Append-only; curve N is at index N.
    ArrayList<RewardCurve> curves = new ArrayList<>();
    
    HashMap<Long, Holder> holders = new HashMap<>();
    
    long totalShares;
    
    BigInteger pointsPerShare = BigInteger.ZERO;
    
    // Sum of all allocations.
    long totalAllocated;
    
    // Sum of all payouts (claims and slashes).
    long totalWithdrawn;
    
    //==================================================================
    // Curves
    //==================================================================
    
    int createCurve(CurveParams params, long now) throws LedgerException {
        if (curves.size() >= Main.MAX_CURVES)
            throw new LedgerException(Error.INVALID_CURVE_PARAMS, "too many curves");
        int id = curves.size();
        curves.add(new RewardCurve(id, params, now));
        return id;
    }
    
    public RewardCurve getCurve(int id) throws LedgerException {
        if (id < 0 || id >= curves.size())
            throw new LedgerException(Error.CURVE_NOT_FOUND, "curve " + id);
        return curves.get(id);
    }
    
    public int getNumCurves() {
        return curves.size();
    }
    
    //==================================================================
    // Reads
    //==================================================================
    
    public long getTotalShares() { return totalShares; }
    public long getTotalAllocated() { return totalAllocated; }
    public long getTotalWithdrawn() { return totalWithdrawn; }
    
    public long balance() {
        return totalAllocated - totalWithdrawn;
    }
    
    public Holder getHolder(long account) {
        Holder h = holders.get(account);
        return (h == null) ? null : h.copy();
    }
    
    public long sharesOf(long account) {
        Holder h = holders.get(account);
        return (h == null) ? 0 : h.numShares;
    }
    
    public long rewardBalanceOf(long account) {
        Holder h = holders.get(account);
        if (h == null)
            return 0;
        return accumulated(h) - h.rewardsWithdrawn;
    }
    
    private long accumulated(Holder h) {
        return pointsPerShare.multiply(BigInteger.valueOf(h.numShares))
                .add(h.pointsCorrection)
                .divide(MAGNITUDE)
                .longValueExact();
    }
    
    //==================================================================
    // Issue / allocate
    //==================================================================
    
    // Shares a payment of `amount` would receive on a curve right now.
    public long previewShares(int curveId, long amount, long now) throws LedgerException {
        return getCurve(curveId).sharesFor(amount, now);
    }
    
    void checkIssue(long numShares) throws LedgerException {
        Bps.add(totalShares, numShares);
    }
    
    // Returns the number of shares issued (0 is a no-op).
    long issueWithCurve(long account, long amount, int curveId, long now) throws LedgerException {
        long numShares = previewShares(curveId, amount, now);
        checkIssue(numShares);
        issue(account, numShares);
        return numShares;
    }
    
    // Caller has called checkIssue().
    void issue(long account, long numShares) {
        if (numShares == 0)
            return;
        Holder h = holders.get(account);
        if (h == null) {
            h = new Holder();
            holders.put(account, h);
        }
        h.numShares += numShares;
        h.pointsCorrection = h.pointsCorrection.subtract(pointsPerShare.multiply(BigInteger.valueOf(numShares)));
        totalShares += numShares;
    }
    
    // Raises the value of every share. Returns false, doing nothing, if 
    //   there are no shares to give the amount to.
    boolean allocate(long amount) throws LedgerException {
        if (amount == 0 || totalShares == 0)
            return false;
        long allocated = Bps.add(totalAllocated, amount);
        distribute(amount);
        totalAllocated = allocated;
        return true;
    }
    
    // Spreads an amount already counted in the pool balance over the 
    //   remaining shares. With no shares left nobody could ever claim it, 
    //   so it leaves the pool and goes back to the creator balance.
    void redistribute(long amount) {
        if (amount == 0)
            return;
        if (totalShares > 0)
            distribute(amount);
        else
            totalAllocated -= amount;
    }
    
    private void distribute(long amount) {
        pointsPerShare = pointsPerShare.add(
                BigInteger.valueOf(amount).multiply(MAGNITUDE).divide(BigInteger.valueOf(totalShares)));
    }
    
    //==================================================================
    // Claim / burn
    //==================================================================
    
    // Advances the holder's checkpoint by its whole entitlement and 
    //   returns it. The caller pays it out.
    long claim(long account) {
        Holder h = holders.get(account);
        if (h == null)
            return 0;
        long amount = accumulated(h) - h.rewardsWithdrawn;
        if (amount == 0)
            return 0;
        h.rewardsWithdrawn += amount;
        totalWithdrawn += amount;
        return amount;
    }
    
    // Removes all of a holder's shares and returns its unclaimed 
    //   entitlement. The amount is still in the pool balance until the 
    //   caller either paidOut() or redistribute()s it.
    long burn(long account) {
        Holder h = holders.remove(account);
        if (h == null)
            return 0;
        long amount = accumulated(h) - h.rewardsWithdrawn;
        totalShares -= h.numShares;
        return amount;
    }
    
    void paidOut(long amount) {
        totalWithdrawn += amount;
    }
    
    // Moves a holder record to another account, merging if the 
    //   destination already holds shares.
    void moveHolder(long from, long to) {
        Holder h = holders.remove(from);
        if (h == null)
            return;
        Holder dest = holders.get(to);
        if (dest == null) {
            holders.put(to, h);
            return;
        }
        dest.numShares += h.numShares;
        dest.pointsCorrection = dest.pointsCorrection.add(h.pointsCorrection);
        dest.rewardsWithdrawn += h.rewardsWithdrawn;
    }
}
