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
 * Thrown by every ledger operation that refuses to run. 
 * Carries one of the Error codes. No state was changed when this is thrown.
 */
public class LedgerException extends Exception {
    private static final long serialVersionUID = 1L;
    
    private final int code;
    
    public LedgerException(int code) {
        super(Error.nameOf(code));
        this.code = code;
    }
    
    public LedgerException(int code, String detail) {
        super(Error.nameOf(code) + ": " + detail);
        this.code = code;
    }

    public LedgerException(int code, Throwable cause) {
        super(Error.nameOf(code), cause);
        this.code = code;
    }
    
    public int getCode() { return code; }
    
    public ErrorKind getKind() { return Error.kindOf(code); }
}
