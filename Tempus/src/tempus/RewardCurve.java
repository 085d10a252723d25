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
 * An immutable reward curve. Converts currency into shares with a 
 *   multiplier that never increases over time, so that early 
 *   participants get more shares per unit paid.
 */
public class RewardCurve implements Serializable {
    private static final long serialVersionUID = 1L;
    
    public final int id;
    public final DecayFormula formula;
    public final long formulaBase;
    public final int numPeriods;
    public final long periodSeconds;
    public final long startTimestamp;
    public final long minMultiplier;
    
    // multiplier at startTimestamp
    public final long startMultiplier;
    
    RewardCurve(int id, CurveParams params, long now) throws LedgerException {
        if (params.formula == null)
            throw new LedgerException(Error.INVALID_CURVE_PARAMS, "no formula");
        if (params.numPeriods < 0 || params.minMultiplier < 0 || params.startTimestamp < 0)
            throw new LedgerException(Error.INVALID_CURVE_PARAMS, "negative value");
        if (params.numPeriods > Main.MAX_CURVE_PERIODS)
            throw new LedgerException(Error.INVALID_CURVE_PARAMS, "too many periods");
        if (params.numPeriods > 0 && (params.periodSeconds <= 0 || params.formulaBase < 1))
            throw new LedgerException(Error.INVALID_CURVE_PARAMS, "decaying curve needs a period and a base");
        this.id = id;
        this.formula = params.formula;
        this.formulaBase = params.formulaBase;
        this.numPeriods = params.numPeriods;
        this.periodSeconds = params.periodSeconds;
        this.startTimestamp = (params.startTimestamp == 0) ? now : params.startTimestamp;
        this.minMultiplier = params.minMultiplier;
        try {
            this.startMultiplier = Math.max(minMultiplier, formula.multiplier(formulaBase, numPeriods));
        } catch (LedgerException e) {
            throw new LedgerException(Error.INVALID_CURVE_PARAMS, "start multiplier overflows");
        }
    }
    
    public long multiplier(long now) {
        if (numPeriods == 0)
            return minMultiplier;
        long elapsed = Math.max(0, now - startTimestamp);
        long periods = elapsed / periodSeconds;
        if (periods >= numPeriods)
            return minMultiplier;
        try {
            return Math.max(minMultiplier, formula.multiplier(formulaBase, numPeriods - periods));
        } catch (LedgerException e) {
            return startMultiplier; // never happens, bounded by the start multiplier
        }
    }
    
    public long sharesFor(long amount, long now) throws LedgerException {
        return Bps.mul(amount, multiplier(now));
    }
}
