package com.forgelang.compiler.contract;

import com.forgelang.compiler.ast.decl.FnDecl;
import com.forgelang.compiler.ast.decl.ImplBlock;
import com.forgelang.compiler.ast.decl.Item;
import com.forgelang.compiler.ast.decl.ModuleDecl;
import com.forgelang.compiler.ast.decl.StructDecl;
import com.forgelang.compiler.ast.expr.Expression;
import com.forgelang.compiler.ast.stmt.ExpressionStmt;
import com.forgelang.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

/**
 * 合约模块解析器
 *
 * <p>按声明顺序扫描模块的顶层项：记录唯一的公开结构体，收集以它为目标类型的 impl 块，
 * 并从这些块中移除名为 {@code new} 的方法。其他类型的 impl 块原样保留，不生成导出。
 * 第一个遇到的 {@code new} 的首条表达式语句作为构造表达式，其所有权转移给状态声明。</p>
 */
public class ContractParser {

    private static final Logger LOG = Logger.getLogger(ContractParser.class.getName());

    static final String CONSTRUCTOR_NAME = "new";

    static final String MISSING_PUBLIC_TYPE_MESSAGE =
            "A contract module must define exactly one public struct that serves as the contract's state.";
    static final String MULTIPLE_PUBLIC_TYPES_MESSAGE =
            "Only one public struct is allowed in a contract module. Ensure your module defines "
                    + "exactly one public struct that serves as the contract's state.";

    /**
     * 解析模块。会就地修改模块中的 impl 块（移除 new）。
     *
     * @throws StructuralException 没有或有多个公开结构体
     */
    public ContractComponents parse(ModuleDecl module) {
        StructDecl publicType = null;
        List<ImplBlock> blocks = new ArrayList<ImplBlock>();
        List<ContractDiagnostic> warnings = new ArrayList<ContractDiagnostic>();
        FnDecl constructorMethod = null;
        Expression constructor = null;

        for (Item item : module.getItems()) {
            if (item instanceof StructDecl && item.isPublic()) {
                if (publicType != null) {
                    throw new StructuralException(DiagnosticKind.MULTIPLE_PUBLIC_TYPES,
                            MULTIPLE_PUBLIC_TYPES_MESSAGE + " Found '" + publicType.getName()
                                    + "' and '" + item.getName() + "'.",
                            item.getNameLocation());
                }
                publicType = (StructDecl) item;
            }
        }
        if (publicType == null) {
            throw new StructuralException(DiagnosticKind.MISSING_PUBLIC_TYPE,
                    MISSING_PUBLIC_TYPE_MESSAGE, module.getNameLocation());
        }

        for (Item item : module.getItems()) {
            if (item instanceof ImplBlock) {
                ImplBlock block = (ImplBlock) item;
                if (!publicType.getName().equals(block.getName())) {
                    LOG.fine("Skipping impl block for '" + block.getName() + "' at " + block.getLocation()
                            + "; only blocks of '" + publicType.getName() + "' are exported");
                    continue;
                }
                blocks.add(block);

                Iterator<FnDecl> it = block.getMethods().iterator();
                while (it.hasNext()) {
                    FnDecl method = it.next();
                    if (!CONSTRUCTOR_NAME.equals(method.getName())) {
                        continue;
                    }
                    it.remove();
                    if (constructorMethod == null) {
                        constructorMethod = method;
                        constructor = extractConstructor(method, warnings);
                    } else {
                        warnings.add(ContractDiagnostic.warning(DiagnosticKind.DUPLICATE_CONSTRUCTOR,
                                "Only the first `new` function initializes the contract state; this one is dropped "
                                        + "(first defined at " + constructorMethod.getNameLocation() + ").",
                                method.getNameLocation()));
                    }
                }
            }
        }

        LOG.fine("Parsed contract module '" + module.getName() + "': type " + publicType.getName()
                + ", " + blocks.size() + " impl block(s), constructor "
                + (constructor != null ? "found" : "missing"));
        return new ContractComponents(module, publicType, blocks, constructorMethod, constructor, warnings);
    }

    /**
     * 取 new 的首条语句；仅当其为表达式语句时才是构造表达式
     */
    private Expression extractConstructor(FnDecl method, List<ContractDiagnostic> warnings) {
        List<Statement> statements = method.getBody().getStatements();
        if (statements.isEmpty()) {
            return null;
        }
        if (statements.size() > 1) {
            warnings.add(ContractDiagnostic.warning(DiagnosticKind.CONSTRUCTOR_STATEMENTS_IGNORED,
                    "Only the first statement of `new` initializes the contract state; "
                            + (statements.size() - 1) + " following statement(s) are ignored.",
                    statements.get(1).getLocation()));
        }
        Statement first = statements.get(0);
        if (first instanceof ExpressionStmt) {
            return ((ExpressionStmt) first).getExpression();
        }
        return null;
    }
}
