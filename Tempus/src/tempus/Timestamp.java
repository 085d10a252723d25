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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Date;

/**
 * Static methods to operate on a long that represents UNIX Epoch time 
 *   in whole seconds. This is the ledger's only notion of time.
 */
public class Timestamp {
    
    public static final long MINUTE = 60;
    public static final long HOUR = 60 * MINUTE;
    public static final long DAY = 24 * HOUR;
    
    public static long fromDate(Date date) {
        return date.getTime() / 1000;
    }
    
    public static Date toDate(long timestamp) {
        return new Date(timestamp * 1000);
    }
    
    public static long now() {
        return Instant.now().getEpochSecond();
    }
    
    public static LocalDateTime toUTCLocalDateTime(long timestamp) {
        return Instant.ofEpochSecond(timestamp).atOffset(ZoneOffset.UTC).toLocalDateTime();
    }
}
