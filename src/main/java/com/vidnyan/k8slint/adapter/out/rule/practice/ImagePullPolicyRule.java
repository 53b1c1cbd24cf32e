package com.vidnyan.k8slint.adapter.out.rule.practice;

import com.vidnyan.k8slint.adapter.out.rule.ContainerRule;
import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.BasicLit;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.Expr;
import com.vidnyan.k8slint.domain.ast.KeyValueExpr;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.lint.FixResult;
import com.vidnyan.k8slint.domain.lint.Issue;
import com.vidnyan.k8slint.domain.lint.RuleFix;
import com.vidnyan.k8slint.domain.lint.Severity;
import com.vidnyan.k8slint.domain.match.ImageReference;
import com.vidnyan.k8slint.domain.match.Matchers;
import com.vidnyan.k8slint.domain.match.ResourceKinds;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Containers with a literal image should state their pull policy. The fix writes the
 * policy Kubernetes would default to, right after the {@code Image} field.
 */
public class ImagePullPolicyRule extends ContainerRule {

    public static final String ID = "WK8105";

    static final String FIELD = "ImagePullPolicy";

    public ImagePullPolicyRule() {
        super(ID, "Explicit ImagePullPolicy", "Containers should set ImagePullPolicy explicitly", Severity.WARNING);
    }

    @Override
    protected Optional<Issue> checkContainer(SourceFile file, CompositeLit container) {
        return missingPolicyImage(container).map(image -> issue(file, container, String.format(
                "Container with image \"%s\" should have explicit ImagePullPolicy", image)));
    }

    @Override
    public Optional<RuleFix> fix() {
        return Optional.of(ImagePullPolicyRule::addPullPolicies);
    }

    private static List<FixResult> addPullPolicies(SourceFile file) {
        List<FixResult> results = new ArrayList<>();
        for (CompositeLit container : AstWalker.compositeLiterals(file)) {
            if (!ResourceKinds.isContainer(container)) {
                continue;
            }
            Optional<String> image = missingPolicyImage(container);
            if (image.isEmpty()) {
                continue;
            }
            String policy = ImageReference.parse(image.get()).defaultPullPolicy();
            container.insertElement(insertionIndex(container),
                    KeyValueExpr.syntheticField(FIELD, BasicLit.syntheticString(policy)));
            results.add(FixResult.applied(file.path(), ID, String.format(
                    "Added ImagePullPolicy: \"%s\" for image \"%s\" at line %d",
                    policy, image.get(), container.span().line())));
        }
        return results;
    }

    private static Optional<String> missingPolicyImage(CompositeLit container) {
        if (Matchers.hasField(container, FIELD)) {
            return Optional.empty();
        }
        return Matchers.fieldValue(container, "Image")
                .flatMap(Matchers::stringLiteral)
                .filter(image -> !image.isEmpty());
    }

    private static int insertionIndex(CompositeLit container) {
        List<Expr> elements = container.elements();
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) instanceof KeyValueExpr keyValue && "Image".equals(keyValue.keyName())) {
                return i + 1;
            }
        }
        return elements.size();
    }
}
