package com.ciro.jrxpass;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@AnalyzeClasses(packages = "com.ciro.jrxpass", importOptions = ImportOption.DoNotIncludeTests.class)
public class ArchitectureRulesTest {

    // 1. El modelo del IR no sabe nada del tokenizer ni de los pasos
    @ArchTest
    static final ArchRule ir_is_self_contained = noClasses()
            .that().resideInAPackage("com.ciro.jrxpass.ir..")
            .should().dependOnClassesThat().resideInAnyPackage("com.ciro.jrxpass.lexer..", "com.ciro.jrxpass.pass..")
            .because("Los pasos dependen del IR, nunca al revés.");

    // 2. El tokenizer es una pieza externa: no conoce el IR
    @ArchTest
    static final ArchRule lexer_does_not_know_the_ir = noClasses()
            .that().resideInAPackage("com.ciro.jrxpass.lexer..")
            .should().dependOnClassesThat().resideInAnyPackage("com.ciro.jrxpass.ir..", "com.ciro.jrxpass.pass..")
            .because("El tokenizer se puede reemplazar por cualquier implementación de MarkupTokenizer.");

    // 3. Los fallos de reescritura no se declaran: abortan el template
    @ArchTest
    static final ArchRule pass_exceptions_are_unchecked = classes()
            .that().resideInAPackage("com.ciro.jrxpass.pass..")
            .and().areAssignableTo(Exception.class)
            .should().beAssignableTo(RuntimeException.class)
            .because("Un árbol reconstruido a medias no se puede usar.");

    // 4. Nodos creados fuera del paquete ir no pueden extender el modelo
    @ArchTest
    static final ArchRule only_ir_extends_nodes = classes()
            .that().areAssignableTo("com.ciro.jrxpass.ir.IrNode")
            .should().resideInAPackage("com.ciro.jrxpass.ir..");
}
