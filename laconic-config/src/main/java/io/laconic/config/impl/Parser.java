/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;

import io.laconic.config.ConfigException;
import io.laconic.config.ConfigParseOptions;
import io.laconic.config.ConfigSectionNode;
import io.laconic.config.Configuration;

/**
 * Recursive descent over a token list:
 *
 * <pre>
 * root    := name ('=' value)? '{' content '}' END
 * content := entry*
 * entry   := name ('=' value)? ('{' content '}')?
 * </pre>
 *
 * An entry with a body is a section, an entry with only a value is an
 * attribute.
 */
final class Parser {

    static private final class ParseContext {
        final private List<Token> tokens;
        final private ConfigParseOptions options;
        // names of the sections we are inside, innermost first
        final private LinkedList<String> pathStack;
        private int index;

        ParseContext(List<Token> tokens, ConfigParseOptions options) {
            this.tokens = tokens;
            this.options = options;
            this.pathStack = new LinkedList<String>();
            this.index = 0;
        }

        private Token peekToken() {
            if (index >= tokens.size())
                return tokens.get(tokens.size() - 1);
            return tokens.get(index);
        }

        private Token nextToken() {
            Token t = peekToken();
            if (index < tokens.size())
                index += 1;
            return t;
        }

        private ConfigException parseError(Token t, String message) {
            return new ConfigException.Parse(t.start(), message);
        }

        private String currentSectionPath() {
            if (pathStack.isEmpty())
                return null;
            StringBuilder sb = new StringBuilder();
            Iterator<String> i = pathStack.descendingIterator();
            while (i.hasNext()) {
                sb.append('/');
                sb.append(i.next());
            }
            return sb.toString();
        }

        private String addKeyName(String message) {
            String sectionPath = currentSectionPath();
            if (sectionPath != null) {
                return "in section '" + sectionPath + "': " + message;
            } else {
                return message;
            }
        }

        private void expect(TokenType type, String what) {
            Token t = nextToken();
            if (t.tokenType() != type)
                throw parseError(t, addKeyName("Expecting " + what + " but got " + t));
        }

        private String readName() {
            Token t = nextToken();
            if (t.tokenType() == TokenType.IDENTIFIER || t.tokenType() == TokenType.STRING)
                return t.text();
            throw parseError(t, addKeyName("Expecting a name but got " + t
                    + " (quote the name if it is meant literally)"));
        }

        // null for the null keyword
        private String readValue(String name) {
            Token t = nextToken();
            if (t.tokenType() == TokenType.NULL)
                return null;
            if (t.tokenType() == TokenType.IDENTIFIER || t.tokenType() == TokenType.STRING)
                return t.text();
            throw parseError(t, addKeyName("Expecting a value after '" + name + "=' but got " + t));
        }

        private void parseContent(ConfigSectionNode parent) {
            while (true) {
                Token t = peekToken();
                if (t.tokenType() == TokenType.CLOSE_CURLY)
                    return;
                if (t.tokenType() == TokenType.END)
                    throw parseError(t, addKeyName("Unexpected end of file, expecting a close brace '}'"));

                Token nameToken = t;
                String name = readName();
                String value = null;
                boolean hasValue = false;
                if (peekToken().tokenType() == TokenType.EQUALS) {
                    nextToken();
                    value = readValue(name);
                    hasValue = value != null;
                }

                if (peekToken().tokenType() == TokenType.OPEN_CURLY) {
                    nextToken();
                    ConfigSectionNode section = parent.addChildNode(name, value);
                    pathStack.push(name);
                    parseContent(section);
                    expect(TokenType.CLOSE_CURLY, "a close brace '}'");
                    pathStack.pop();
                } else if (hasValue) {
                    parent.addAttributeNode(name, value);
                } else {
                    throw parseError(nameToken, addKeyName("Entry '" + name
                            + "' has neither a value nor a section body"));
                }
            }
        }

        Configuration parse() {
            expect(TokenType.START, "start of input");
            String rootName = readName();
            String rootValue = null;
            if (peekToken().tokenType() == TokenType.EQUALS) {
                nextToken();
                rootValue = readValue(rootName);
            }
            expect(TokenType.OPEN_CURLY, "an open brace '{' after the root name");

            Configuration config = new Configuration(options.getResolveOptions(), false).create(
                    rootName, rootValue);
            parseContent(config.root());
            expect(TokenType.CLOSE_CURLY, "a close brace '}' ending the root section");
            expect(TokenType.END, "end of input after the root section");
            config.root().resetModified();

            if (options.getReadOnly())
                return config.asReadOnly();
            return config;
        }
    }

    static Configuration parse(List<Token> tokens, ConfigParseOptions options) {
        if (tokens.isEmpty())
            throw new ConfigException.BugOrBroken("empty token list");
        ParseContext context = new ParseContext(tokens, options);
        return context.parse();
    }
}
