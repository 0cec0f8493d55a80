package com.ciro.jrxpass.pass;

import com.ciro.jrxpass.ir.HtmlAttributeNode;
import com.ciro.jrxpass.ir.HtmlContentNode;
import com.ciro.jrxpass.ir.HtmlElementNode;
import com.ciro.jrxpass.ir.HtmlTextNode;
import com.ciro.jrxpass.ir.IrNode;
import com.ciro.jrxpass.ir.MethodNode;
import com.ciro.jrxpass.lexer.HtmlToken;
import com.ciro.jrxpass.lexer.HtmlTokenType;
import com.ciro.jrxpass.lexer.MarkupTokenizer;
import com.ciro.jrxpass.lexer.TagAttribute;
import com.ciro.jrxpass.lexer.TokenizerFactory;
import com.ciro.jrxpass.lexer.VoidElements;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Reconstruye los hijos de un nodo que mezcla HTML opaco con nodos ya estructurados.
 *
 * <p>Se recorren los hijos originales en orden. Las corridas de HTML se tokenizan y
 * sus etiquetas abren/cierran elementos en una pila de puntos de inserción; el resto
 * de hijos (expresiones, bloques, atributos dinámicos) se cuelga del tope actual de
 * la pila, así conservan su posición relativa aunque un elemento quede abierto entre
 * dos corridas de HTML.
 *
 * <p>Cualquier desbalance aborta con {@link RewriteException}. El nodo solo se
 * modifica si la reconstrucción termina bien.
 */
public class HtmlTreeBuilder {

    private final TokenizerFactory tokenizerFactory;

    public HtmlTreeBuilder(TokenizerFactory tokenizerFactory) {
        this.tokenizerFactory = tokenizerFactory;
    }

    /**
     * Reemplaza los hijos de {@code node} por el árbol reconstruido y devuelve la nueva lista.
     */
    public List<IrNode> rebuild(IrNode node) {
        List<IrNode> original = new ArrayList<>(node.getChildren());
        Reconstruction reconstruction = new Reconstruction(node);

        for (IrNode child : original) {
            switch (child.kind()) {
                case HTML_CONTENT -> reconstruction.tokenize(((HtmlContentNode) child).content());
                case HTML_ATTRIBUTE -> reconstruction.attribute((HtmlAttributeNode) child);
                // No es HTML, o ya fue reescrito
                default -> reconstruction.append(child);
            }
        }

        List<IrNode> rebuilt = reconstruction.finish();
        node.replaceChildren(rebuilt);
        return rebuilt;
    }

    private final class Reconstruction {
        private final IrNode root;
        private final List<IrNode> rootChildren = new ArrayList<>();
        private final Deque<IrNode> stack = new ArrayDeque<>();

        Reconstruction(IrNode root) {
            this.root = root;
            stack.push(root);
        }

        void tokenize(String html) {
            MarkupTokenizer tokenizer = tokenizerFactory.create(html);

            HtmlToken token;
            while ((token = tokenizer.next()).type() != HtmlTokenType.END_OF_FILE) {
                switch (token.type()) {
                    case CHARACTER -> character(token.data());
                    case START_TAG -> startTag(token);
                    case END_TAG -> endTag(token.name());
                    case COMMENT -> {
                        // los comentarios no llegan al árbol
                    }
                    default -> throw RewriteException.unsupportedToken(token.type());
                }
            }
        }

        void character(String text) {
            // Solo en el nivel superior del método se ignora el espacio en blanco.
            // Dentro de un bloque puede estar separando contenido de un elemento abierto afuera.
            if (stack.peek() instanceof MethodNode && isWhitespace(text)) {
                return;
            }
            append(new HtmlTextNode(text));
        }

        void startTag(HtmlToken tag) {
            HtmlElementNode element = new HtmlElementNode(tag.name());
            append(element);
            stack.push(element);

            for (TagAttribute attribute : tag.attributes()) {
                element.addChild(AttributeNodes.create(attribute));
            }

            if (tag.selfClosing() && VoidElements.isVoid(tag.name())) {
                stack.pop();
            }
        }

        void endTag(String name) {
            if (stack.peek() == root) {
                throw RewriteException.unbalancedClose(name, null);
            }
            IrNode popped = stack.pop();
            if (popped instanceof HtmlElementNode element) {
                if (!element.hasTagName(name)) {
                    throw RewriteException.unbalancedClose(name, element.tagName);
                }
            } else {
                throw RewriteException.unbalancedClose(name, null);
            }
        }

        void attribute(HtmlAttributeNode attribute) {
            if (!(stack.peek() instanceof HtmlElementNode)) {
                throw RewriteException.attributeOutsideElement(attribute.attributeName);
            }
            append(attribute);
        }

        void append(IrNode child) {
            IrNode top = stack.peek();
            if (top == root) {
                rootChildren.add(child);
            } else {
                top.addChild(child);
            }
        }

        List<IrNode> finish() {
            if (stack.size() != 1 || stack.peek() != root) {
                List<String> unclosed = new ArrayList<>();
                for (Iterator<IrNode> it = stack.descendingIterator(); it.hasNext(); ) {
                    IrNode open = it.next();
                    if (open instanceof HtmlElementNode element) unclosed.add(element.tagName);
                }
                throw RewriteException.unbalancedTree(unclosed);
            }
            return rootChildren;
        }
    }

    // Incluye los espacios Unicode como U+00A0 (&nbsp;), que String.isBlank no considera
    static boolean isWhitespace(String text) {
        return text.codePoints().allMatch(c -> Character.isWhitespace(c) || Character.isSpaceChar(c) || c == 0x85);
    }
}
