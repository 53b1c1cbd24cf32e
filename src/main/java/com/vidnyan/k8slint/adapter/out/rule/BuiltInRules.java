package com.vidnyan.k8slint.adapter.out.rule;

import com.vidnyan.k8slint.adapter.out.rule.availability.AntiAffinityRule;
import com.vidnyan.k8slint.adapter.out.rule.availability.DisruptionBudgetRule;
import com.vidnyan.k8slint.adapter.out.rule.availability.ReplicaCountRule;
import com.vidnyan.k8slint.adapter.out.rule.organization.ResourceCountRule;
import com.vidnyan.k8slint.adapter.out.rule.practice.ContainerNameRule;
import com.vidnyan.k8slint.adapter.out.rule.practice.HealthProbeRule;
import com.vidnyan.k8slint.adapter.out.rule.practice.ImagePullPolicyRule;
import com.vidnyan.k8slint.adapter.out.rule.practice.LatestImageTagRule;
import com.vidnyan.k8slint.adapter.out.rule.practice.MissingLabelsRule;
import com.vidnyan.k8slint.adapter.out.rule.practice.PortNameRule;
import com.vidnyan.k8slint.adapter.out.rule.practice.ResourceLimitsRule;
import com.vidnyan.k8slint.adapter.out.rule.practice.SelectorLabelRule;
import com.vidnyan.k8slint.adapter.out.rule.security.DropCapabilitiesRule;
import com.vidnyan.k8slint.adapter.out.rule.security.HardcodedSecretRule;
import com.vidnyan.k8slint.adapter.out.rule.security.HostNamespaceRule;
import com.vidnyan.k8slint.adapter.out.rule.security.PrivateKeyRule;
import com.vidnyan.k8slint.adapter.out.rule.security.PrivilegedContainerRule;
import com.vidnyan.k8slint.adapter.out.rule.security.SecurityContextFlagRule;
import com.vidnyan.k8slint.adapter.out.rule.security.TokenPatternRule;
import com.vidnyan.k8slint.adapter.out.rule.structure.CircularReferenceRule;
import com.vidnyan.k8slint.adapter.out.rule.structure.DirectDeclarationRule;
import com.vidnyan.k8slint.adapter.out.rule.structure.DuplicateResourceRule;
import com.vidnyan.k8slint.adapter.out.rule.structure.NestingDepthRule;
import com.vidnyan.k8slint.domain.lint.Rule;
import com.vidnyan.k8slint.domain.lint.RuleRegistry;

import java.util.List;

/**
 * The built-in rule set, in catalogue order. Fixes run in this order too.
 */
public final class BuiltInRules {

    private BuiltInRules() {
    }

    public static List<Rule> all() {
        return List.of(
                new DirectDeclarationRule(),
                new NestingDepthRule(),
                new DuplicateResourceRule(),
                new CircularReferenceRule(),
                new HardcodedSecretRule(),
                new LatestImageTagRule(),
                new TokenPatternRule(),
                new PrivateKeyRule(),
                new SelectorLabelRule(),
                new MissingLabelsRule(),
                new ContainerNameRule(),
                new PortNameRule(),
                new ImagePullPolicyRule(),
                new ResourceLimitsRule(),
                new PrivilegedContainerRule(),
                SecurityContextFlagRule.readOnlyRootFilesystem(),
                SecurityContextFlagRule.runAsNonRoot(),
                new DropCapabilitiesRule(),
                HostNamespaceRule.hostNetwork(),
                HostNamespaceRule.hostPid(),
                HostNamespaceRule.hostIpc(),
                new HealthProbeRule(),
                new ReplicaCountRule(),
                new DisruptionBudgetRule(),
                new AntiAffinityRule(),
                new ResourceCountRule());
    }

    public static RuleRegistry registry() {
        return new RuleRegistry(all());
    }
}
