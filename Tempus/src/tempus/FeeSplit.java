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
 * The legs a single payment was split into.
 * protocolFee + clientFee + referralFee + net == amount.
 */
public class FeeSplit implements Serializable {
    private static final long serialVersionUID = 1L;
    
    public long amount;
    public long protocolFee;
    public long clientFee;
    public long referralFee;
    public int referralBps;
    
    // What stays in the ledger for the creator and the reward pool.
    public long net;
}
