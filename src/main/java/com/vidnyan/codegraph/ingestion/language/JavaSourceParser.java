package com.vidnyan.codegraph.ingestion.language;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.domain.model.FileEntry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * JavaParser-based extraction of Java types, members, imports and call sites.
 */
@Component
public class JavaSourceParser implements SourceParser {

    private final ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    @Override
    public Set<SourceLanguage> languages() {
        return Set.of(SourceLanguage.JAVA);
    }

    @Override
    public ParsedFile parse(FileEntry file, SourceLanguage language) {
        // JavaParser instances keep state between parses, so one per file
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(file.content());
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problem = result.getProblems().isEmpty() ? "unknown error"
                    : result.getProblems().get(0).getMessage();
            throw new SourceParseException("Java parse failed for " + file.path() + ": " + problem);
        }

        CompilationUnit cu = result.getResult().get();
        ParsedFile.Builder builder = ParsedFile.builder(file.path(), language);

        cu.getImports().forEach(imp -> builder.importSpec(toImportSpec(imp)));
        cu.getTypes().forEach(td -> processType(td, null, builder));

        cu.findAll(MethodCallExpr.class).forEach(call ->
                builder.call(new ParsedFile.CallSite(call.getNameAsString(), line(call), call.getScope().isPresent())));
        cu.findAll(ObjectCreationExpr.class).forEach(creation ->
                builder.call(new ParsedFile.CallSite(creation.getType().getNameAsString(), line(creation), false)));
        cu.findAll(MethodReferenceExpr.class).stream()
                .filter(ref -> !"new".equals(ref.getIdentifier()))
                .forEach(ref -> builder.call(new ParsedFile.CallSite(ref.getIdentifier(), line(ref), true)));

        return builder.build();
    }

    private ParsedFile.ImportSpec toImportSpec(ImportDeclaration imp) {
        String name = imp.getNameAsString();
        if (imp.isAsterisk()) {
            // static wildcard imports name a class, plain ones a package
            return new ParsedFile.ImportSpec(name, List.of(), !imp.isStatic(), line(imp));
        }
        String simple = name.substring(name.lastIndexOf('.') + 1);
        String specifier = imp.isStatic() ? name.substring(0, Math.max(0, name.lastIndexOf('.'))) : name;
        return new ParsedFile.ImportSpec(specifier, List.of(simple), false, line(imp));
    }

    private void processType(TypeDeclaration<?> td, String owner, ParsedFile.Builder builder) {
        String name = td.getNameAsString();
        String qualified = owner == null ? name : owner + "." + name;
        NodeLabel label = labelOf(td);

        builder.symbol(new ParsedFile.Symbol(name, qualified, label,
                line(td), endLine(td), td.isPublic(), owner));

        if (td instanceof ClassOrInterfaceDeclaration cid) {
            cid.getExtendedTypes().forEach(ext -> heritage(builder, qualified, ext, RelationshipType.EXTENDS));
            cid.getImplementedTypes().forEach(impl -> heritage(builder, qualified, impl, RelationshipType.IMPLEMENTS));
        } else if (td instanceof EnumDeclaration ed) {
            ed.getImplementedTypes().forEach(impl -> heritage(builder, qualified, impl, RelationshipType.IMPLEMENTS));
        } else if (td instanceof RecordDeclaration rd) {
            rd.getImplementedTypes().forEach(impl -> heritage(builder, qualified, impl, RelationshipType.IMPLEMENTS));
        }

        for (BodyDeclaration<?> member : td.getMembers()) {
            if (member instanceof MethodDeclaration md) {
                builder.symbol(new ParsedFile.Symbol(md.getNameAsString(), qualified + "." + md.getNameAsString(),
                        NodeLabel.METHOD, line(md), endLine(md), md.isPublic(), qualified));
            } else if (member instanceof ConstructorDeclaration cd) {
                builder.symbol(new ParsedFile.Symbol(cd.getNameAsString(), qualified + "." + cd.getNameAsString(),
                        NodeLabel.METHOD, line(cd), endLine(cd), cd.isPublic(), qualified));
            } else if (member instanceof FieldDeclaration fd) {
                fd.getVariables().forEach(v -> builder.symbol(new ParsedFile.Symbol(v.getNameAsString(),
                        qualified + "." + v.getNameAsString(), NodeLabel.VARIABLE,
                        line(fd), endLine(fd), fd.isPublic(), qualified)));
            } else if (member instanceof TypeDeclaration<?> nested) {
                processType(nested, qualified, builder);
            }
        }
    }

    private static NodeLabel labelOf(TypeDeclaration<?> td) {
        if (td instanceof ClassOrInterfaceDeclaration cid && cid.isInterface()) {
            return NodeLabel.INTERFACE;
        }
        if (td.isAnnotationDeclaration()) {
            return NodeLabel.INTERFACE;
        }
        return NodeLabel.CLASS;
    }

    private static void heritage(ParsedFile.Builder builder, String child, ClassOrInterfaceType parent,
                                 RelationshipType type) {
        builder.heritage(new ParsedFile.HeritageClause(child, parent.getNameAsString(), type));
    }

    private static int line(Node node) {
        return node.getBegin().map(p -> p.line).orElse(0);
    }

    private static int endLine(Node node) {
        return node.getEnd().map(p -> p.line).orElse(line(node));
    }
}
