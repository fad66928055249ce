package css.nesting;

import java.util.List;
import java.util.Objects;

/// Syntax tree for style sheets that may contain nested rules.
///
/// A sheet is a forest: an ordered `List<Node>` of top-level nodes. Style rules and
/// at-rules own an ordered list of heterogeneous children; declarations and markers are leaves.
/// All nodes are immutable and never reference their parent.
public sealed interface CssAst {

    /// Discriminator for the node variants, switched on by tree walkers.
    enum Kind {
        STYLE_RULE,
        AT_RULE,
        DECLARATION,
        MARKER
    }

    /// Any node that may appear in a rule body or at the top level of a sheet.
    sealed interface Node extends CssAst permits StyleRule, AtRule, Declaration, MarkerStatement {
        Kind kind();
    }

    /// `selectors { children }`
    record StyleRule(SelectorList selectors, List<Node> children) implements Node {
        public StyleRule {
            Objects.requireNonNull(selectors, "selectors must not be null");
            Objects.requireNonNull(children, "children must not be null");
            children = List.copyOf(children);
        }

        public StyleRule(String selectors, Node... children) {
            this(SelectorList.parse(selectors), List.of(children));
        }

        @Override
        public Kind kind() {
            return Kind.STYLE_RULE;
        }
    }

    /// `@name prelude { children }`
    ///
    /// The name is held without its leading `@`. The prelude is kept as raw text and never
    /// interpreted.
    record AtRule(String name, String prelude, List<Node> children) implements Node {
        public AtRule {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(prelude, "prelude must not be null");
            Objects.requireNonNull(children, "children must not be null");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("at-rule name must not be empty");
            }
            if (name.charAt(0) == '@') {
                throw new IllegalArgumentException("at-rule name must not include '@': " + name);
            }
            children = List.copyOf(children);
        }

        public AtRule(String name, String prelude, Node... children) {
            this(name, prelude, List.of(children));
        }

        /// Same name and prelude, different body.
        public AtRule withChildren(List<Node> newChildren) {
            return new AtRule(name, prelude, newChildren);
        }

        @Override
        public Kind kind() {
            return Kind.AT_RULE;
        }
    }

    record Declaration(String property, String value, boolean important) implements Node {
        public Declaration {
            Objects.requireNonNull(property, "property must not be null");
            Objects.requireNonNull(value, "value must not be null");
            if (property.isEmpty()) {
                throw new IllegalArgumentException("property must not be empty");
            }
        }

        public Declaration(String property, String value) {
            this(property, value, false);
        }

        @Override
        public Kind kind() {
            return Kind.DECLARATION;
        }
    }

    /// Opaque body-less at-rule statement such as `@slot`, carried through every transform untouched.
    record MarkerStatement(String text) implements Node {
        public MarkerStatement {
            Objects.requireNonNull(text, "text must not be null");
            if (text.isBlank()) {
                throw new IllegalArgumentException("marker text must not be blank");
            }
            if (text.charAt(0) != '@') {
                throw new IllegalArgumentException("marker text must start with '@': " + text);
            }
        }

        @Override
        public Kind kind() {
            return Kind.MARKER;
        }
    }
}
