/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

public enum DynamicsType implements Vocabulary {
    P("p"),
    PP("pp"),
    PPP("ppp"),
    PPPP("pppp"),
    PPPPP("ppppp"),
    PPPPPP("pppppp"),
    F("f"),
    FF("ff"),
    FFF("fff"),
    FFFF("ffff"),
    FFFFF("fffff"),
    FFFFFF("ffffff"),
    MP("mp"),
    MF("mf"),
    SF("sf"),
    SFP("sfp"),
    SFPP("sfpp"),
    FP("fp"),
    RF("rf"),
    RFZ("rfz"),
    SFZ("sfz"),
    SFFZ("sffz"),
    FZ("fz"),
    N("n"),
    PF("pf"),
    SFZP("sfzp");

    private final String value;

    DynamicsType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
