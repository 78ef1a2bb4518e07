/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.ccfront.cc.ir.type;

import javax.annotation.Nullable;

/** The kinds of C types.  Basic kinds carry their C spelling. */
public enum CTypeKind {
    VOID("void"),
    BOOL("_Bool"),
    CHAR("char"),
    UCHAR("unsigned char"),
    SHORT("short"),
    USHORT("unsigned short"),
    INT("int"),
    UINT("unsigned int"),
    LONG("long"),
    ULONG("unsigned long"),
    LONGLONG("long long"),
    ULONGLONG("unsigned long long"),
    FLOAT("float"),
    DOUBLE("double"),
    LONGDOUBLE("long double"),
    // Tagged types
    ENUM("enum"),
    STRUCT("struct"),
    UNION("union"),
    // typedef name
    NAMED(null),
    // Derived types
    POINTER(null),
    ARRAY(null),
    FUNC(null);

    /** Keyword spelling; for tagged types the keyword preceding the tag. */
    @Nullable
    public final String cName;

    CTypeKind(@Nullable String cName) {
        this.cName = cName;
    }

    public boolean isBasic() {
        return this.ordinal() <= LONGDOUBLE.ordinal();
    }

    public boolean isTagged() {
        return this == ENUM || this == STRUCT || this == UNION;
    }

    public boolean isDerived() {
        return this == POINTER || this == ARRAY || this == FUNC;
    }

    @Override
    public String toString() {
        return this.cName != null ? this.cName : this.name().toLowerCase();
    }
}
