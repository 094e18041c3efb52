/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.javascript.jstrip;

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/** The named character references of XHTML 1.0, which JSX text and attribute strings may use. */
final class XhtmlEntities {
  private static final ImmutableMap<String, Integer> CODE_POINTS =
      ImmutableMap.<String, Integer>builder()
          .put("quot", 0x0022)
          .put("amp", 0x0026)
          .put("apos", 0x0027)
          .put("lt", 0x003C)
          .put("gt", 0x003E)
          .put("nbsp", 0x00A0)
          .put("iexcl", 0x00A1)
          .put("cent", 0x00A2)
          .put("pound", 0x00A3)
          .put("curren", 0x00A4)
          .put("yen", 0x00A5)
          .put("brvbar", 0x00A6)
          .put("sect", 0x00A7)
          .put("uml", 0x00A8)
          .put("copy", 0x00A9)
          .put("ordf", 0x00AA)
          .put("laquo", 0x00AB)
          .put("not", 0x00AC)
          .put("shy", 0x00AD)
          .put("reg", 0x00AE)
          .put("macr", 0x00AF)
          .put("deg", 0x00B0)
          .put("plusmn", 0x00B1)
          .put("sup2", 0x00B2)
          .put("sup3", 0x00B3)
          .put("acute", 0x00B4)
          .put("micro", 0x00B5)
          .put("para", 0x00B6)
          .put("middot", 0x00B7)
          .put("cedil", 0x00B8)
          .put("sup1", 0x00B9)
          .put("ordm", 0x00BA)
          .put("raquo", 0x00BB)
          .put("frac14", 0x00BC)
          .put("frac12", 0x00BD)
          .put("frac34", 0x00BE)
          .put("iquest", 0x00BF)
          .put("Agrave", 0x00C0)
          .put("Aacute", 0x00C1)
          .put("Acirc", 0x00C2)
          .put("Atilde", 0x00C3)
          .put("Auml", 0x00C4)
          .put("Aring", 0x00C5)
          .put("AElig", 0x00C6)
          .put("Ccedil", 0x00C7)
          .put("Egrave", 0x00C8)
          .put("Eacute", 0x00C9)
          .put("Ecirc", 0x00CA)
          .put("Euml", 0x00CB)
          .put("Igrave", 0x00CC)
          .put("Iacute", 0x00CD)
          .put("Icirc", 0x00CE)
          .put("Iuml", 0x00CF)
          .put("ETH", 0x00D0)
          .put("Ntilde", 0x00D1)
          .put("Ograve", 0x00D2)
          .put("Oacute", 0x00D3)
          .put("Ocirc", 0x00D4)
          .put("Otilde", 0x00D5)
          .put("Ouml", 0x00D6)
          .put("times", 0x00D7)
          .put("Oslash", 0x00D8)
          .put("Ugrave", 0x00D9)
          .put("Uacute", 0x00DA)
          .put("Ucirc", 0x00DB)
          .put("Uuml", 0x00DC)
          .put("Yacute", 0x00DD)
          .put("THORN", 0x00DE)
          .put("szlig", 0x00DF)
          .put("agrave", 0x00E0)
          .put("aacute", 0x00E1)
          .put("acirc", 0x00E2)
          .put("atilde", 0x00E3)
          .put("auml", 0x00E4)
          .put("aring", 0x00E5)
          .put("aelig", 0x00E6)
          .put("ccedil", 0x00E7)
          .put("egrave", 0x00E8)
          .put("eacute", 0x00E9)
          .put("ecirc", 0x00EA)
          .put("euml", 0x00EB)
          .put("igrave", 0x00EC)
          .put("iacute", 0x00ED)
          .put("icirc", 0x00EE)
          .put("iuml", 0x00EF)
          .put("eth", 0x00F0)
          .put("ntilde", 0x00F1)
          .put("ograve", 0x00F2)
          .put("oacute", 0x00F3)
          .put("ocirc", 0x00F4)
          .put("otilde", 0x00F5)
          .put("ouml", 0x00F6)
          .put("divide", 0x00F7)
          .put("oslash", 0x00F8)
          .put("ugrave", 0x00F9)
          .put("uacute", 0x00FA)
          .put("ucirc", 0x00FB)
          .put("uuml", 0x00FC)
          .put("yacute", 0x00FD)
          .put("thorn", 0x00FE)
          .put("yuml", 0x00FF)
          .put("OElig", 0x0152)
          .put("oelig", 0x0153)
          .put("Scaron", 0x0160)
          .put("scaron", 0x0161)
          .put("Yuml", 0x0178)
          .put("fnof", 0x0192)
          .put("circ", 0x02C6)
          .put("tilde", 0x02DC)
          .put("Alpha", 0x0391)
          .put("Beta", 0x0392)
          .put("Gamma", 0x0393)
          .put("Delta", 0x0394)
          .put("Epsilon", 0x0395)
          .put("Zeta", 0x0396)
          .put("Eta", 0x0397)
          .put("Theta", 0x0398)
          .put("Iota", 0x0399)
          .put("Kappa", 0x039A)
          .put("Lambda", 0x039B)
          .put("Mu", 0x039C)
          .put("Nu", 0x039D)
          .put("Xi", 0x039E)
          .put("Omicron", 0x039F)
          .put("Pi", 0x03A0)
          .put("Rho", 0x03A1)
          .put("Sigma", 0x03A3)
          .put("Tau", 0x03A4)
          .put("Upsilon", 0x03A5)
          .put("Phi", 0x03A6)
          .put("Chi", 0x03A7)
          .put("Psi", 0x03A8)
          .put("Omega", 0x03A9)
          .put("alpha", 0x03B1)
          .put("beta", 0x03B2)
          .put("gamma", 0x03B3)
          .put("delta", 0x03B4)
          .put("epsilon", 0x03B5)
          .put("zeta", 0x03B6)
          .put("eta", 0x03B7)
          .put("theta", 0x03B8)
          .put("iota", 0x03B9)
          .put("kappa", 0x03BA)
          .put("lambda", 0x03BB)
          .put("mu", 0x03BC)
          .put("nu", 0x03BD)
          .put("xi", 0x03BE)
          .put("omicron", 0x03BF)
          .put("pi", 0x03C0)
          .put("rho", 0x03C1)
          .put("sigmaf", 0x03C2)
          .put("sigma", 0x03C3)
          .put("tau", 0x03C4)
          .put("upsilon", 0x03C5)
          .put("phi", 0x03C6)
          .put("chi", 0x03C7)
          .put("psi", 0x03C8)
          .put("omega", 0x03C9)
          .put("thetasym", 0x03D1)
          .put("upsih", 0x03D2)
          .put("piv", 0x03D6)
          .put("ensp", 0x2002)
          .put("emsp", 0x2003)
          .put("thinsp", 0x2009)
          .put("zwnj", 0x200C)
          .put("zwj", 0x200D)
          .put("lrm", 0x200E)
          .put("rlm", 0x200F)
          .put("ndash", 0x2013)
          .put("mdash", 0x2014)
          .put("lsquo", 0x2018)
          .put("rsquo", 0x2019)
          .put("sbquo", 0x201A)
          .put("ldquo", 0x201C)
          .put("rdquo", 0x201D)
          .put("bdquo", 0x201E)
          .put("dagger", 0x2020)
          .put("Dagger", 0x2021)
          .put("bull", 0x2022)
          .put("hellip", 0x2026)
          .put("permil", 0x2030)
          .put("prime", 0x2032)
          .put("Prime", 0x2033)
          .put("lsaquo", 0x2039)
          .put("rsaquo", 0x203A)
          .put("oline", 0x203E)
          .put("frasl", 0x2044)
          .put("euro", 0x20AC)
          .put("image", 0x2111)
          .put("weierp", 0x2118)
          .put("real", 0x211C)
          .put("trade", 0x2122)
          .put("alefsym", 0x2135)
          .put("larr", 0x2190)
          .put("uarr", 0x2191)
          .put("rarr", 0x2192)
          .put("darr", 0x2193)
          .put("harr", 0x2194)
          .put("crarr", 0x21B5)
          .put("lArr", 0x21D0)
          .put("uArr", 0x21D1)
          .put("rArr", 0x21D2)
          .put("dArr", 0x21D3)
          .put("hArr", 0x21D4)
          .put("forall", 0x2200)
          .put("part", 0x2202)
          .put("exist", 0x2203)
          .put("empty", 0x2205)
          .put("nabla", 0x2207)
          .put("isin", 0x2208)
          .put("notin", 0x2209)
          .put("ni", 0x220B)
          .put("prod", 0x220F)
          .put("sum", 0x2211)
          .put("minus", 0x2212)
          .put("lowast", 0x2217)
          .put("radic", 0x221A)
          .put("prop", 0x221D)
          .put("infin", 0x221E)
          .put("ang", 0x2220)
          .put("and", 0x2227)
          .put("or", 0x2228)
          .put("cap", 0x2229)
          .put("cup", 0x222A)
          .put("int", 0x222B)
          .put("there4", 0x2234)
          .put("sim", 0x223C)
          .put("cong", 0x2245)
          .put("asymp", 0x2248)
          .put("ne", 0x2260)
          .put("equiv", 0x2261)
          .put("le", 0x2264)
          .put("ge", 0x2265)
          .put("sub", 0x2282)
          .put("sup", 0x2283)
          .put("nsub", 0x2284)
          .put("sube", 0x2286)
          .put("supe", 0x2287)
          .put("oplus", 0x2295)
          .put("otimes", 0x2297)
          .put("perp", 0x22A5)
          .put("sdot", 0x22C5)
          .put("lceil", 0x2308)
          .put("rceil", 0x2309)
          .put("lfloor", 0x230A)
          .put("rfloor", 0x230B)
          .put("lang", 0x2329)
          .put("rang", 0x232A)
          .put("loz", 0x25CA)
          .put("spades", 0x2660)
          .put("clubs", 0x2663)
          .put("hearts", 0x2665)
          .put("diams", 0x2666)
          .buildOrThrow();

  /** Returns the text {@code &name;} stands for, or {@code null} if it is not an entity. */
  static @Nullable String decode(String name) {
    Integer codePoint = CODE_POINTS.get(name);
    return codePoint == null ? null : new String(Character.toChars(codePoint));
  }

  private XhtmlEntities() {}
}
