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
 * Generic ledger figures (read-only snapshot).
 */
public class LedgerStats implements Serializable {
    private static final long serialVersionUID = 1L;
    
    public boolean initialized;
    public String asset;
    public long owner;
    public int tierCount;
    public long subCount;
    public long globalSupplyCap;
    public long tokenIdCounter;
    
    // Currency held by the ledger == creatorBalance + poolBalance.
    public long heldBalance;
    public long creatorBalance;
    public long poolBalance;
    
    public long eventCount;
    public long usedMemoryBytes;
}
