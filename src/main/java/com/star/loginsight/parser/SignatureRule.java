package com.star.loginsight.parser;

import lombok.NonNull;
import lombok.Value;

/**
 * Maps a case-insensitive message regex to a short, stable error signature code.
 */
@Value(staticConstructor = "of")
public class SignatureRule {

    @NonNull
    String code;

    @NonNull
    String regex;
}
