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
 * Pool-wide reward settings.
 */
public class RewardParams implements Serializable {
    private static final long serialVersionUID = 1L;
    
    // Whether lapsed holders can be slashed. Can be turned off, never 
    //   back on.
    public boolean slashable;
    
    // How long after expiry a holder keeps its shares.
    public long slashGracePeriod;
    
    public RewardParams() {
    }
    
    public RewardParams(boolean slashable, long slashGracePeriod) {
        this.slashable = slashable;
        this.slashGracePeriod = slashGracePeriod;
    }
    
    public RewardParams copy() {
        return new RewardParams(slashable, slashGracePeriod);
    }
}
