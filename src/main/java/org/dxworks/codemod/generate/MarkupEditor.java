package org.dxworks.codemod.generate;

import org.dxworks.codemod.CodemodConfig;
import org.dxworks.codemod.model.ErrorKind;
import org.dxworks.codemod.model.ModificationException;
import org.dxworks.codemod.model.TextEdit;
import org.dxworks.codemod.parser.SourceText;
import org.dxworks.codemod.parser.SyntaxNode;
import org.dxworks.codemod.parser.SyntaxTree;
import org.dxworks.codemod.query.ElementLocator;
import org.dxworks.codemod.query.NodeQuery;
import org.dxworks.codemod.request.ClassNameSpec;
import org.dxworks.codemod.request.ElementTarget;
import org.dxworks.codemod.request.MarkupPosition;
import org.dxworks.codemod.request.PropSpec;
import org.dxworks.codemod.request.WrapperSpec;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.dxworks.codemod.query.TreeHelper.*;

/**
 * Edits on JSX elements, all computed from ranges of the original tree.
 */
public class MarkupEditor {
    static final int WRAP_OUTER_PRIORITY = 70;
    static final int WRAP_INNER_PRIORITY = 50;
    static final int MARKUP_PRIORITY = 60;
    static final int PROP_PRIORITY = 60;
    static final int DELETE_PRIORITY = 40;

    private final SyntaxTree tree;
    private final NodeQuery query;
    private final SourceText source;
    private final String indentation;

    public MarkupEditor(NodeQuery query, CodemodConfig config) {
        this.tree = query.getTree();
        this.query = query;
        this.source = tree.getSource();
        this.indentation = config.getIndentation();
    }

    /**
     * Surrounds the target with {@code <Component props>} and {@code </Component>}. The original
     * range itself is left untouched, so edits inside the target still compose.
     */
    public List<TextEdit> wrap(ElementTarget target, WrapperSpec wrapper, int sequence) {
        SyntaxNode node = resolve(target);
        StringBuilder opening = new StringBuilder("<").append(wrapper.getComponent());
        for (Map.Entry<String, String> prop : wrapper.getProps().entrySet()) {
            opening.append(" ").append(prop.getKey()).append("={").append(prop.getValue()).append("}");
        }
        opening.append(">");
        String closing = "</" + wrapper.getComponent() + ">";

        String description = "wrap " + target.describe() + " in <" + wrapper.getComponent() + ">";
        // the wrapper sits inside markup inserted before the element and outside markup inserted after it;
        // closing tags use the negated sequence so a later wrapper closes before an earlier one
        return List.of(
                TextEdit.insert(node.getStartIndex(), opening.toString(), WRAP_INNER_PRIORITY, sequence, description + " (opening)")
                        .anchoredTo(node.getStartIndex(), node.getEndIndex()),
                TextEdit.insert(node.getEndIndex(), closing, WRAP_OUTER_PRIORITY, -sequence, description + " (closing)")
                        .anchoredTo(node.getStartIndex(), node.getEndIndex()));
    }

    public List<TextEdit> insert(ElementTarget target, MarkupPosition position, String markup, int sequence) {
        SyntaxNode element = resolve(target);
        String indent = source.columnIndentation(element.getStartIndex());
        String description = "insert markup " + position + " " + target.describe();

        switch (position) {
            case BEFORE:
                return List.of(TextEdit.insert(element.getStartIndex(), markup + "\n" + indent,
                        WRAP_OUTER_PRIORITY, sequence, description)
                        .anchoredTo(element.getStartIndex(), element.getEndIndex()));
            case AFTER:
                return List.of(TextEdit.insert(element.getEndIndex(), "\n" + indent + markup,
                        WRAP_INNER_PRIORITY, sequence, description)
                        .anchoredTo(element.getStartIndex(), element.getEndIndex()));
            case INSIDE_START: {
                SyntaxNode opening = requireChildren(element, target).openingTag;
                return List.of(TextEdit.insert(opening.getEndIndex(), "\n" + indent + indentation + markup,
                        MARKUP_PRIORITY, sequence, description));
            }
            case INSIDE_END: {
                SyntaxNode closing = requireChildren(element, target).closingTag;
                int at = closing.getStartIndex();
                if (source.isFirstOnLine(at)) {
                    return List.of(TextEdit.insert(source.lineStart(at), indent + indentation + markup + "\n",
                            MARKUP_PRIORITY, sequence, description));
                }
                return List.of(TextEdit.insert(at, "\n" + indent + indentation + markup + "\n" + indent,
                        MARKUP_PRIORITY, sequence, description));
            }
            default:
                throw new IllegalArgumentException("Unknown markup position: " + position);
        }
    }

    /**
     * Removes the first element matching {@code locator}. When the element starts its line, the
     * line's indentation and the preceding line break go with it.
     */
    public List<TextEdit> delete(ElementLocator locator, int sequence) {
        SyntaxNode element = query.findElement(locator).orElseThrow(() ->
                new ModificationException(ErrorKind.TARGET_NOT_FOUND, "no element matches " + locator.describe()));
        int start = element.getStartIndex();
        int end = element.getEndIndex();
        if (source.isFirstOnLine(start)) {
            int lineStart = source.lineStart(start);
            if (lineStart > 0) {
                start = lineStart - 1;
            } else {
                start = lineStart;
                if (source.charAtIs(end, '\n')) end++;
            }
        }
        return List.of(TextEdit.replace(start, end, "", DELETE_PRIORITY, sequence, "delete " + locator.describe()));
    }

    public List<TextEdit> modifyProp(ElementTarget target, PropSpec prop, int sequence) {
        SyntaxNode element = resolve(target);
        SyntaxNode attribute = findAttribute(element, prop.getName());
        String description = prop.getAction().name().toLowerCase() + " prop '" + prop.getName() + "' on " + target.describe();

        if (prop.getAction() == PropSpec.Action.REMOVE) {
            if (attribute == null) {
                throw new ModificationException(ErrorKind.TARGET_NOT_FOUND,
                        "prop '" + prop.getName() + "' not present on " + target.describe());
            }
            return List.of(removeAttribute(attribute, sequence, description));
        }

        if (attribute != null) {
            return List.of(TextEdit.replace(attribute.getStartIndex(), attribute.getEndIndex(), prop.render(),
                    PROP_PRIORITY, sequence, description));
        }
        SyntaxNode tagName = getTagNameNode(element);
        if (tagName == null) {
            throw new ModificationException(ErrorKind.TARGET_NOT_FOUND,
                    "cannot add a prop to a fragment: " + target.describe());
        }
        return List.of(TextEdit.insert(tagName.getEndIndex(), " " + prop.render(), PROP_PRIORITY, sequence, description));
    }

    /**
     * Rewrites the {@code className} attribute token by token. String literals and template literals
     * are understood; the classes of a template literal are those before its first substitution,
     * the substitutions themselves are kept. An attribute left without classes is removed.
     */
    public List<TextEdit> modifyClassName(ElementTarget target, ClassNameSpec spec, int sequence) {
        SyntaxNode element = resolve(target);
        SyntaxNode attribute = findAttribute(element, "className");
        SyntaxNode value = attribute == null ? null : getAttributeValue(attribute);
        String description = "change className (" + spec.describe() + ") on " + target.describe();

        ClassNameValue current = ClassNameValue.parse(value, target);
        Set<String> classes = new LinkedHashSet<>(current.classes);
        classes.removeAll(spec.getRemove());
        classes.addAll(spec.getAdd());

        List<String> dynamic = new ArrayList<>();
        if (!current.substitutions.isEmpty()) dynamic.add(current.substitutions);
        if (spec.getCondition() != null) {
            dynamic.add("${" + spec.getCondition() + " ? '" + spec.getWhenTrue() + "' : '" + spec.getWhenFalse() + "'}");
        }

        String rendered;
        if (!dynamic.isEmpty()) {
            List<String> parts = new ArrayList<>(classes);
            parts.addAll(dynamic);
            rendered = "{`" + String.join(" ", parts) + "`}";
        } else if (!classes.isEmpty()) {
            rendered = current.quote + String.join(" ", classes) + current.quote;
        } else if (attribute != null) {
            return List.of(removeAttribute(attribute, sequence, description));
        } else {
            return List.of();
        }

        if (value != null) {
            return List.of(TextEdit.replace(value.getStartIndex(), value.getEndIndex(), rendered,
                    PROP_PRIORITY, sequence, description));
        }
        if (attribute != null) {
            return List.of(TextEdit.replace(attribute.getStartIndex(), attribute.getEndIndex(), "className=" + rendered,
                    PROP_PRIORITY, sequence, description));
        }
        SyntaxNode tagName = getTagNameNode(element);
        if (tagName == null) {
            throw new ModificationException(ErrorKind.TARGET_NOT_FOUND,
                    "cannot add a className to a fragment: " + target.describe());
        }
        return List.of(TextEdit.insert(tagName.getEndIndex(), " className=" + rendered, PROP_PRIORITY, sequence, description));
    }

    private TextEdit removeAttribute(SyntaxNode attribute, int sequence, String description) {
        int start = attribute.getStartIndex();
        int end = attribute.getEndIndex();
        if (source.charAtIs(start - 1, ' ') || source.charAtIs(start - 1, '\t')) {
            start--;
        } else if (source.charAtIs(end, ' ')) {
            end++;
        }
        return TextEdit.replace(start, end, "", PROP_PRIORITY, sequence, description);
    }

    SyntaxNode resolve(ElementTarget target) {
        if (target.getNode() != null) {
            if (!tree.owns(target.getNode())) {
                throw new ModificationException(ErrorKind.TARGET_NOT_FOUND,
                        "node " + target.getNode() + " does not belong to this session's tree");
            }
            return target.getNode();
        }
        return query.findElement(target.getLocator()).orElseThrow(() ->
                new ModificationException(ErrorKind.TARGET_NOT_FOUND, "no element matches " + target.describe()));
    }

    private Tags requireChildren(SyntaxNode element, ElementTarget target) {
        if (!"jsx_element".equals(element.getType())) {
            throw new ModificationException(ErrorKind.TARGET_NOT_FOUND,
                    "cannot insert inside " + target.describe() + ": it has no children section");
        }
        SyntaxNode opening = getOpeningTag(element);
        SyntaxNode closing = getClosingTag(element);
        if (opening == null || closing == null) {
            throw new ModificationException(ErrorKind.TARGET_NOT_FOUND,
                    "cannot find the tags of " + target.describe());
        }
        return new Tags(opening, closing);
    }

    private static final class ClassNameValue {
        final List<String> classes = new ArrayList<>();
        String substitutions = "";
        String quote = "\"";

        static ClassNameValue parse(SyntaxNode value, ElementTarget target) {
            ClassNameValue parsed = new ClassNameValue();
            if (value == null) return parsed;

            SyntaxNode literal = value;
            if ("jsx_expression".equals(value.getType())) {
                literal = value.getNamedChildCount() == 1 ? value.getNamedChild(0) : null;
            }
            String text = literal == null ? "" : literal.getText();
            if (literal != null && "string".equals(literal.getType()) && text.length() >= 2) {
                if (value == literal) {
                    parsed.quote = text.substring(0, 1);
                }
                parsed.split(text.substring(1, text.length() - 1));
                return parsed;
            }
            if (literal != null && "template_string".equals(literal.getType()) && text.length() >= 2) {
                String inner = text.substring(1, text.length() - 1);
                int substitution = inner.indexOf("${");
                parsed.split(substitution < 0 ? inner : inner.substring(0, substitution));
                if (substitution >= 0) parsed.substitutions = inner.substring(substitution).trim();
                return parsed;
            }
            throw new ModificationException(ErrorKind.TARGET_NOT_FOUND,
                    "className of " + target.describe() + " is neither a string nor a template literal: " + value.getText());
        }

        private void split(String classList) {
            for (String token : classList.trim().split("\\s+")) {
                if (!token.isEmpty()) classes.add(token);
            }
        }
    }

    private static final class Tags {
        final SyntaxNode openingTag;
        final SyntaxNode closingTag;

        Tags(SyntaxNode openingTag, SyntaxNode closingTag) {
            this.openingTag = openingTag;
            this.closingTag = closingTag;
        }
    }
}
