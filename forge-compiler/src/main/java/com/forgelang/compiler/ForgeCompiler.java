package com.forgelang.compiler;

import com.forgelang.compiler.ast.SourceLocation;
import com.forgelang.compiler.ast.decl.SourceFile;
import com.forgelang.compiler.contract.ContractDiagnostic;
import com.forgelang.compiler.contract.ContractExpander;
import com.forgelang.compiler.contract.DiagnosticKind;
import com.forgelang.compiler.contract.ExpansionOptions;
import com.forgelang.compiler.contract.ExpansionResult;
import com.forgelang.compiler.lexer.Lexer;
import com.forgelang.compiler.lexer.Token;
import com.forgelang.compiler.parser.ParseException;
import com.forgelang.compiler.parser.Parser;
import com.forgelang.compiler.printer.PrintConfig;
import com.forgelang.compiler.printer.SourcePrinter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Forge 编译器入口：解析、合约展开、源码输出
 */
public class ForgeCompiler {

    private static final Logger LOG = Logger.getLogger(ForgeCompiler.class.getName());

    private final ExpansionOptions options;
    private final PrintConfig printConfig;

    public ForgeCompiler(ExpansionOptions options, PrintConfig printConfig) {
        this.options = options;
        this.printConfig = printConfig;
    }

    public ForgeCompiler() {
        this(new ExpansionOptions(), new PrintConfig());
    }

    /**
     * 解析源码
     *
     * @throws ParseException 语法错误
     */
    public SourceFile parse(String source, String fileName) {
        Lexer lexer = new Lexer(source, fileName);
        Parser parser = new Parser(lexer, fileName);
        SourceFile file = parser.parse();
        LOG.fine("Parsed " + fileName + ": " + file.getItems().size() + " top-level item(s)");
        return file;
    }

    /**
     * 解析并展开源码；语法错误作为 ParseError 诊断返回
     */
    public ExpansionResult expand(String source, String fileName) {
        SourceFile file;
        try {
            file = parse(source, fileName);
        } catch (ParseException e) {
            return ExpansionResult.failure(toDiagnostic(e, fileName));
        }
        return new ContractExpander(options).expand(file);
    }

    public ExpansionResult expandFile(Path path) throws IOException {
        String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return expand(source, path.toString());
    }

    public String print(SourceFile file) {
        return new SourcePrinter().print(file, printConfig);
    }

    /**
     * 按统一格式重新输出源码
     *
     * @throws ParseException 语法错误
     */
    public String format(String source, String fileName) {
        return print(parse(source, fileName));
    }

    public ExpansionOptions getOptions() {
        return options;
    }

    public PrintConfig getPrintConfig() {
        return printConfig;
    }

    public static ContractDiagnostic toDiagnostic(ParseException e, String fileName) {
        Token token = e.getToken();
        SourceLocation location = token == null
                ? new SourceLocation(fileName, 1, 1, 0, 0)
                : new SourceLocation(fileName, token.getLine(), token.getColumn(),
                        token.getOffset(), token.getLexeme().length());
        String message = e.getRawMessage();
        if (token != null && !token.getLexeme().isEmpty()) {
            message = message + " (found '" + token.getLexeme() + "')";
        }
        return ContractDiagnostic.error(DiagnosticKind.PARSE_ERROR, message, location);
    }
}
