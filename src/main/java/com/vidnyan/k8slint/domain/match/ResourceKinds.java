package com.vidnyan.k8slint.domain.match;

import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.Expr;

import java.util.Optional;
import java.util.Set;

/**
 * Recognizers for the Kubernetes API shapes the rules care about.
 */
public final class ResourceKinds {

    /** Object metadata field, spelled either way depending on the wrapper library. */
    public static final String METADATA = "Metadata|ObjectMeta";

    public static final String DEPLOYMENT = "Deployment";
    public static final String POD_DISRUPTION_BUDGET = "PodDisruptionBudget";

    /** Top-level kinds expected to carry metadata labels. */
    public static final Set<String> LABELED_KINDS = Set.of(
            "Deployment", "Service", "Pod", "ConfigMap", "Secret",
            "StatefulSet", "DaemonSet", "Ingress", "Job", "CronJob");

    /** Workloads whose selector must match their pod template. */
    public static final Set<String> SELECTOR_WORKLOADS = Set.of("Deployment", "StatefulSet", "DaemonSet");

    /** Import aliases of the Kubernetes API groups. */
    public static final Set<String> API_PACKAGES = Set.of(
            "appsv1", "corev1", "batchv1", "networkingv1", "rbacv1", "storagev1",
            "autoscalingv1", "autoscalingv2", "policyv1");

    private ResourceKinds() {
    }

    public static boolean is(Expr expr, String typeName) {
        return Matchers.typeNameOf(expr).filter(typeName::equals).isPresent();
    }

    public static boolean isAnyOf(Expr expr, Set<String> typeNames) {
        return Matchers.typeNameOf(expr).filter(typeNames::contains).isPresent();
    }

    public static boolean isContainer(Expr expr) {
        return is(expr, "Container");
    }

    public static boolean isPodSpec(Expr expr) {
        return is(expr, "PodSpec");
    }

    public static boolean isEnvVar(Expr expr) {
        return is(expr, "EnvVar");
    }

    /**
     * {@code ContainerPort} or {@code ServicePort}.
     */
    public static boolean isPort(Expr expr) {
        return is(expr, "ContainerPort") || is(expr, "ServicePort");
    }

    /**
     * A literal whose type is qualified by one of the Kubernetes API packages.
     */
    public static boolean isApiResource(Expr expr) {
        return Matchers.packageOf(expr).filter(API_PACKAGES::contains).isPresent();
    }

    public static Optional<CompositeLit> metadata(CompositeLit resource) {
        return Matchers.path(resource, METADATA);
    }
}
