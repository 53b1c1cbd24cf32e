package com.vidnyan.k8slint.adapter.out.rule.availability;

import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.match.Matchers;

final class Replicas {

    static final int HA_MINIMUM = 2;

    private Replicas() {
    }

    /**
     * True only when {@code Spec.Replicas} is a literal of at least {@link #HA_MINIMUM}.
     */
    static boolean isHighlyAvailable(CompositeLit deployment) {
        return Matchers.pathValue(deployment, "Spec", "Replicas")
                .map(Matchers::intLiteral)
                .filter(count -> count >= HA_MINIMUM)
                .isPresent();
    }
}
