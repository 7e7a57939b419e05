// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * The exceptions to the subtag grammar and the deprecated codes used when canonicalizing.
 * All lookups are case-insensitive.
 */
public final class SubtagTables {

    private static final ImmutableList<GrandfatheredTag> grandfathered = ImmutableList.of(
            new GrandfatheredTag("art-lojban", "jbo"),
            new GrandfatheredTag("cel-gaulish", null),
            new GrandfatheredTag("en-GB-oed", "en-GB-oxendict"),
            new GrandfatheredTag("i-ami", "ami"),
            new GrandfatheredTag("i-bnn", "bnn"),
            new GrandfatheredTag("i-default", null),
            new GrandfatheredTag("i-enochian", null),
            new GrandfatheredTag("i-hak", "hak"),
            new GrandfatheredTag("i-klingon", "tlh"),
            new GrandfatheredTag("i-lux", "lb"),
            new GrandfatheredTag("i-mingo", null),
            new GrandfatheredTag("i-navajo", "nv"),
            new GrandfatheredTag("i-pwn", "pwn"),
            new GrandfatheredTag("i-tao", "tao"),
            new GrandfatheredTag("i-tay", "tay"),
            new GrandfatheredTag("i-tsu", "tsu"),
            new GrandfatheredTag("no-bok", "nb"),
            new GrandfatheredTag("no-nyn", "nn"),
            new GrandfatheredTag("sgn-BE-FR", "sfb"),
            new GrandfatheredTag("sgn-BE-NL", "vgt"),
            new GrandfatheredTag("sgn-CH-DE", "sgg"),
            new GrandfatheredTag("zh-guoyu", "cmn"),
            new GrandfatheredTag("zh-hakka", "hak"),
            new GrandfatheredTag("zh-min", null),
            new GrandfatheredTag("zh-min-nan", "nan"),
            new GrandfatheredTag("zh-xiang", "hsn"));

    private static final ImmutableMap<String, GrandfatheredTag> grandfatheredIndex;

    static {
        ImmutableMap.Builder<String, GrandfatheredTag> builder = ImmutableMap.builder();
        for (GrandfatheredTag tag : grandfathered)
            builder.put(SubtagChars.toLowerCase(tag.tag()), tag);
        grandfatheredIndex = builder.build();
    }

    private static final ImmutableMap<String, String> deprecatedLanguages = ImmutableMap.<String, String>builder()
            .put("in", "id")
            .put("iw", "he")
            .put("ji", "yi")
            .put("jw", "jv")
            .put("mo", "ro")
            .put("aam", "aas")
            .put("adp", "dz")
            .put("aue", "ktz")
            .put("ayx", "nun")
            .put("bjd", "drl")
            .put("ccq", "rki")
            .put("cjr", "mom")
            .put("cka", "cmr")
            .put("cmk", "xch")
            .put("drh", "khk")
            .put("drw", "prs")
            .put("gav", "dev")
            .put("gfx", "vaj")
            .put("gti", "nyc")
            .put("hrr", "jal")
            .put("ibi", "opa")
            .put("ilw", "gal")
            .put("kgh", "kml")
            .put("koj", "kwv")
            .put("kwq", "yam")
            .put("kxe", "tvd")
            .put("lii", "raq")
            .put("lmm", "rmx")
            .put("meg", "cir")
            .put("mst", "mry")
            .put("mwj", "vaj")
            .put("myt", "mry")
            .put("nnx", "ngv")
            .put("oun", "vaj")
            .put("pcr", "adx")
            .put("pmu", "phr")
            .put("ppr", "lcq")
            .put("puz", "pub")
            .put("sca", "hle")
            .put("thx", "oyb")
            .put("tie", "ras")
            .put("tkk", "twm")
            .put("tlw", "weo")
            .put("tnf", "prs")
            .put("tsf", "taj")
            .put("uok", "ema")
            .put("xia", "acn")
            .put("xsj", "suj")
            .put("ybd", "rki")
            .put("yma", "lrr")
            .put("ymt", "mtm")
            .put("yos", "zom")
            .put("yuu", "yug")
            .build();

    private static final ImmutableMap<String, String> deprecatedRegions = ImmutableMap.of(
            "BU", "MM",
            "DD", "DE",
            "FX", "FR",
            "TP", "TL",
            "YD", "YE",
            "ZR", "CD");

    private SubtagTables() { }

    /** Returns all grandfathered tags, in registry order */
    public static ImmutableList<GrandfatheredTag> grandfathered() { return grandfathered; }

    /** Returns the grandfathered tag equal to the given string ignoring case, or empty if none */
    public static Optional<GrandfatheredTag> grandfathered(String tag) {
        return Optional.ofNullable(grandfatheredIndex.get(SubtagChars.toLowerCase(tag)));
    }

    /** Returns the replacement of the given deprecated primary language subtag, or empty if it is not deprecated */
    public static Optional<String> deprecatedLanguage(String language) {
        return Optional.ofNullable(deprecatedLanguages.get(SubtagChars.toLowerCase(language)));
    }

    /** Returns the replacement of the given deprecated region subtag, or empty if it is not deprecated */
    public static Optional<String> deprecatedRegion(String region) {
        return Optional.ofNullable(deprecatedRegions.get(SubtagChars.toUpperCase(region)));
    }

}
