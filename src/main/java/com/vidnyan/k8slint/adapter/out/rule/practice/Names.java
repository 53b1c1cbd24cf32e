package com.vidnyan.k8slint.adapter.out.rule.practice;

import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.match.Matchers;

final class Names {

    private Names() {
    }

    /**
     * True when {@code Name} is set to anything but an empty string literal. A name taken
     * from a constant or variable counts.
     */
    static boolean isNamed(CompositeLit literal) {
        return Matchers.fieldValue(literal, "Name")
                .map(name -> Matchers.stringLiteral(name).map(value -> !value.isEmpty()).orElse(true))
                .orElse(false);
    }
}
