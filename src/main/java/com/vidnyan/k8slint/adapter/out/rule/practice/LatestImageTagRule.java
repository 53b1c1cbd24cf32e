package com.vidnyan.k8slint.adapter.out.rule.practice;

import com.vidnyan.k8slint.adapter.out.rule.ContainerRule;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.Expr;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.ImageReference;
import com.vidnyan.k8slint.domain.match.Matchers;

import java.util.Optional;

/**
 * Images must be pinned to a version tag or digest. Not fixable: picking the version
 * is up to the author.
 */
public class LatestImageTagRule extends ContainerRule {

    public static final String ID = "WK8006";

    public LatestImageTagRule() {
        super(ID, "No latest image tag", "Container images must not use :latest or omit the tag", Severity.ERROR);
    }

    @Override
    protected Optional<Issue> checkContainer(SourceFile file, CompositeLit container) {
        Optional<Expr> image = Matchers.fieldValue(container, "Image");
        Optional<String> reference = image.flatMap(Matchers::stringLiteral).filter(value -> !value.isEmpty());
        if (reference.isEmpty() || !ImageReference.parse(reference.get()).resolvesToLatest()) {
            return Optional.empty();
        }
        return Optional.of(issue(file, image.get(), String.format(
                "Image \"%s\" uses :latest tag or no tag (defaults to :latest), specify a version tag",
                reference.get())));
    }
}
