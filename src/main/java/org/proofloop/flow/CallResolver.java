package org.proofloop.flow;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.resolution.declarations.ResolvedMethodDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * 解析调用目标：先按语法（接收者的声明类型），失败后再交给 SymbolSolver
 */
public class CallResolver {

    private static final Logger log = LoggerFactory.getLogger(CallResolver.class);

    // 语言内建的守卫/回滚，不算函数调用
    static final Set<String> BUILTINS = Set.of("require", "revert", "assert");

    private final ContractIndex contracts;

    public CallResolver(ContractIndex contracts) {
        this.contracts = contracts;
    }

    public static boolean isBuiltin(MethodCallExpr call) {
        return call.getScope().isEmpty() && BUILTINS.contains(call.getNameAsString());
    }

    public Optional<Integer> resolve(MethodCallExpr call, int contractId, DefUseCollector scope) {
        String name = call.getNameAsString();
        int argc = call.getArguments().size();

        if (call.getScope().isEmpty()) {
            return contracts.resolveFunction(contractId, name, argc);
        }
        Expression receiver = call.getScope().get();
        if (receiver.isThisExpr()) {
            return contracts.resolveFunction(contractId, name, argc);
        }
        if (receiver.isSuperExpr()) {
            for (int sup : contracts.superTypes(contractId)) {
                Optional<Integer> found = contracts.resolveFunction(sup, name, argc);
                if (found.isPresent()) return found;
            }
            return Optional.empty();
        }

        Optional<Integer> target = receiverContract(receiver, contractId, scope)
                .flatMap(c -> contracts.resolveFunction(c, name, argc));
        if (target.isPresent()) {
            return target;
        }
        return resolveWithSymbolSolver(call, argc);
    }

    public Optional<Integer> resolve(ObjectCreationExpr creation) {
        String type = creation.getType().getNameAsString();
        return contracts.contractByName(type)
                .flatMap(c -> contracts.resolveFunction(c, type, creation.getArguments().size()));
    }

    /**
     * 接收者的声明类型对应的已分析合约
     */
    private Optional<Integer> receiverContract(Expression receiver, int contractId, DefUseCollector scope) {
        String typeName = null;
        if (receiver.isNameExpr()) {
            String n = receiver.asNameExpr().getNameAsString();
            if (scope.isLocal(n)) {
                typeName = scope.localType(n);
            } else {
                typeName = contracts.fieldType(contractId, n).orElse(null);
                if (typeName == null) {
                    // 静态调用 Token.mint(...)
                    typeName = n;
                }
            }
        } else if (receiver.isFieldAccessExpr() && receiver.asFieldAccessExpr().getScope().isThisExpr()) {
            typeName = contracts.fieldType(contractId, receiver.asFieldAccessExpr().getNameAsString()).orElse(null);
        } else if (receiver.isObjectCreationExpr()) {
            typeName = receiver.asObjectCreationExpr().getType().getNameAsString();
        }
        return typeName == null ? Optional.empty() : contracts.contractByName(typeName);
    }

    private Optional<Integer> resolveWithSymbolSolver(MethodCallExpr call, int argc) {
        try {
            ResolvedMethodDeclaration decl = call.resolve();
            return contracts.contractByName(decl.getClassName())
                    .flatMap(c -> contracts.resolveFunction(c, decl.getName(), argc));
        } catch (RuntimeException e) {
            // UnsolvedSymbolException 等：目标在分析范围之外
            log.debug("Symbol solver could not resolve {}: {}", call, e.getMessage());
            return Optional.empty();
        }
    }
}
