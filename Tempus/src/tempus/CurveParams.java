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
 * Parameters of a new reward curve, as supplied to createRewardCurve.
 */
public class CurveParams implements Serializable {
    private static final long serialVersionUID = 1L;
    
    public DecayFormula formula = DecayFormula.EXPONENTIAL;
    
    public long formulaBase = 2;
    
    // Number of decay steps. 0 makes a flat curve at minMultiplier.
    public int numPeriods;
    
    public long periodSeconds;
    
    // When decay starts. 0 means "when the curve is created".
    public long startTimestamp;
    
    // Floor, reached once all periods have elapsed.
    public long minMultiplier = 1;
    
    public CurveParams() {
    }
    
    public CurveParams(DecayFormula formula, long formulaBase, int numPeriods, long periodSeconds, long minMultiplier) {
        this.formula = formula;
        this.formulaBase = formulaBase;
        this.numPeriods = numPeriods;
        this.periodSeconds = periodSeconds;
        this.minMultiplier = minMultiplier;
    }
    
    // One share per unit, forever.
    public static CurveParams flat() {
        return new CurveParams(DecayFormula.EXPONENTIAL, 1, 0, 0, 1);
    }
}
