package com.vidnyan.k8slint.adapter.out.rule.availability;

import com.vidnyan.k8slint.adapter.out.rule.AbstractRule;
import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.Expr;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.Matchers;
import com.vidnyan.k8slint.domain.match.ResourceKinds;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deployments should run at least two replicas. An unset replica count defaults to one
 * and is reported; a count the matcher cannot read is not.
 */
public class ReplicaCountRule extends AbstractRule {

    public static final String ID = "WK8302";

    public ReplicaCountRule() {
        super(ID, "Replica count", "Deployments should run at least 2 replicas", Severity.INFO);
    }

    @Override
    public List<Issue> check(SourceFile file) {
        List<Issue> issues = new ArrayList<>();
        for (CompositeLit deployment : AstWalker.compositeLiterals(file)) {
            if (!ResourceKinds.is(deployment, ResourceKinds.DEPLOYMENT)) {
                continue;
            }
            Optional<Expr> replicas = Matchers.pathValue(deployment, "Spec", "Replicas");
            if (replicas.isEmpty()) {
                issues.add(issue(file, deployment,
                        "Deployment should explicitly set replicas >= 2 for high availability"));
                continue;
            }
            long count = Matchers.intLiteral(replicas.get());
            if (count != Matchers.UNSET && count < Replicas.HA_MINIMUM) {
                issues.add(issue(file, replicas.get(),
                        "Deployment should have at least 2 replicas for high availability"));
            }
        }
        return issues;
    }
}
