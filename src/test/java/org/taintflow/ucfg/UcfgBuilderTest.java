/*
 * Copyright 2025 The Taintflow Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.taintflow.ucfg;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.taintflow.cfg.BinaryBranchBlock;
import org.taintflow.cfg.Block;
import org.taintflow.cfg.ControlFlowGraph;
import org.taintflow.cfg.ExitBlock;
import org.taintflow.cfg.JumpBlock;
import org.taintflow.cfg.SimpleBlock;
import org.taintflow.semantic.AttributeData;
import org.taintflow.semantic.BoundSemanticModel;
import org.taintflow.semantic.EntryPointRecognizer;
import org.taintflow.semantic.KnownType;
import org.taintflow.semantic.MethodKind;
import org.taintflow.semantic.MethodSymbol;
import org.taintflow.semantic.Symbol;
import org.taintflow.semantic.TypeSymbol;
import org.taintflow.syntax.SourceSpan;
import org.taintflow.syntax.SyntaxKind;
import org.taintflow.syntax.SyntaxNode;

@RunWith(JUnit4.class)
public class UcfgBuilderTest {

  private static final String FILE = "Shop/Orders.cs";
  private static final SourceSpan DECLARATION_SPAN = SourceSpan.onLine(FILE, 9, 2, 30);

  private static final TypeSymbol INT = TypeSymbol.of("System.Int32");
  private static final TypeSymbol BOOL = TypeSymbol.of("System.Boolean");
  private static final TypeSymbol OBJECT = TypeSymbol.of("System.Object");
  private static final TypeSymbol ORDERS = TypeSymbol.of("Shop.Orders");
  private static final TypeSymbol SEARCH_CONTROLLER =
      TypeSymbol.of(
          "Shop.SearchController", TypeSymbol.of(KnownType.ASP_NET_CORE_CONTROLLER.typeName));

  private BoundSemanticModel model;
  private UcfgBuilder builder;

  /** Each node gets a line of its own, so that instructions can be told apart by location. */
  private int nextLine;

  @Before
  public void setUp() {
    model = new BoundSemanticModel();
    builder = new UcfgBuilder(EntryPointRecognizer.NONE);
    nextLine = 20;
  }

  private SourceSpan span() {
    return SourceSpan.onLine(FILE, nextLine++, 8, 20);
  }

  private SyntaxNode.Identifier ref(Symbol symbol) {
    SyntaxNode.Identifier identifier = new SyntaxNode.Identifier(symbol.name, span());
    model.bind(identifier, symbol);
    return identifier;
  }

  private SyntaxNode.Literal stringLiteral(String text) {
    return new SyntaxNode.Literal(SyntaxKind.STRING_LITERAL_EXPRESSION, "\"" + text + "\"", span());
  }

  private SyntaxNode.Binary plus(SyntaxNode left, SyntaxNode right) {
    return new SyntaxNode.Binary(SyntaxKind.ADD_EXPRESSION, left, right, span());
  }

  private SyntaxNode.Invocation call(
      SyntaxNode callee, @Nullable MethodSymbol method, SyntaxNode... arguments) {
    SyntaxNode.Invocation invocation =
        new SyntaxNode.Invocation(callee, ImmutableList.copyOf(arguments), span());
    if (method != null) {
      model.bind(invocation, method);
    }
    return invocation;
  }

  private SyntaxNode.Invocation call(MethodSymbol method, SyntaxNode... arguments) {
    return call(new SyntaxNode.Identifier(method.name, span()), method, arguments);
  }

  private SyntaxNode.Invocation callOn(
      SyntaxNode receiver, MethodSymbol method, SyntaxNode... arguments) {
    SyntaxNode.MemberAccess callee =
        new SyntaxNode.MemberAccess(
            receiver, new SyntaxNode.Identifier(method.name, span()), span());
    return call(callee, method, arguments);
  }

  private SyntaxNode.Assignment assign(Symbol target, SyntaxNode value) {
    return new SyntaxNode.Assignment(ref(target), value, span());
  }

  private SyntaxNode.VariableDeclarator declare(
      Symbol.Local local, @Nullable SyntaxNode initializer) {
    SyntaxNode.VariableDeclarator declarator =
        new SyntaxNode.VariableDeclarator(local.name, initializer, span());
    model.declare(declarator, local);
    return declarator;
  }

  private SyntaxNode.Return ret(@Nullable SyntaxNode expression) {
    return new SyntaxNode.Return(expression, span());
  }

  private static JumpBlock returnBlock(SyntaxNode.Return ret, SyntaxNode... instructions) {
    return new JumpBlock(ImmutableList.copyOf(instructions), ret);
  }

  private static SimpleBlock simpleBlock(SyntaxNode... instructions) {
    return new SimpleBlock(ImmutableList.copyOf(instructions));
  }

  /** Returns a CFG that runs the given blocks in order and then exits. */
  private static ControlFlowGraph straightLine(Block... blocks) {
    ExitBlock exit = new ExitBlock();
    for (int i = 0; i < blocks.length; i++) {
      blocks[i].linkTo(i + 1 < blocks.length ? blocks[i + 1] : exit);
    }
    ImmutableList<Block> all = ImmutableList.<Block>builder().add(blocks).add(exit).build();
    return ControlFlowGraph.of(all, blocks.length == 0 ? exit : blocks[0], exit);
  }

  private SyntaxNode.MethodDeclaration declarationOf(SyntaxKind kind, MethodSymbol method) {
    ImmutableList<SyntaxNode.Parameter> parameters =
        method.parameters.stream()
            .map(p -> new SyntaxNode.Parameter(p.name, span()))
            .collect(toImmutableList());
    return new SyntaxNode.MethodDeclaration(kind, method.name, parameters, DECLARATION_SPAN);
  }

  private Ucfg build(MethodSymbol method, ControlFlowGraph cfg) {
    return builder.build(
        model, declarationOf(SyntaxKind.METHOD_DECLARATION, method), method, cfg);
  }

  private static ImmutableList<String> listing(BasicBlock block) {
    return block.instructions().stream().map(Instruction::toString).collect(toImmutableList());
  }

  private static MethodSymbol.Builder method(String name) {
    return MethodSymbol.builder(name, ORDERS);
  }

  private static Location locationOf(SyntaxNode node) {
    return Location.of(node);
  }

  @Test
  public void emptyMethodHasOneConstantReturn() {
    MethodSymbol method = method("Touch").build();

    Ucfg ucfg = build(method, straightLine());

    assertThat(ucfg.basicBlocks).hasSize(1);
    BasicBlock block = ucfg.basicBlocks.get(0);
    assertThat(block.id()).isEqualTo("0");
    assertThat(block.instructions()).isEmpty();
    assertThat(block.terminator()).isEqualTo(new Terminator.Return(null, Expression.CONSTANT));
    assertThat(ucfg.entries).containsExactly("0");
  }

  @Test
  public void methodHeaderIsRecorded() {
    MethodSymbol method =
        method("Find")
            .returns(TypeSymbol.STRING)
            .parameter("id", INT)
            .parameter("name", TypeSymbol.STRING)
            .build();

    Ucfg ucfg = build(method, straightLine());

    assertThat(ucfg.methodId).isEqualTo("Shop.Orders.Find(System.Int32, System.String)");
    assertThat(ucfg.location).isEqualTo(new Location(FILE, 10, 2, 10, 29));
    assertThat(ucfg.parameters).containsExactly("id", "name").inOrder();
  }

  @Test
  public void nonStringReturnIsConstant() {
    MethodSymbol method = method("Count").returns(INT).build();
    SyntaxNode one = new SyntaxNode.Literal(SyntaxKind.NUMERIC_LITERAL_EXPRESSION, "1", span());
    SyntaxNode.Return ret = ret(one);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret, one)));

    assertThat(ucfg.basicBlocks).hasSize(2);
    BasicBlock body = ucfg.basicBlocks.get(0);
    assertThat(body.instructions()).isEmpty();
    assertThat(body.terminator())
        .isEqualTo(new Terminator.Return(locationOf(ret), Expression.CONSTANT));
    assertThat(ucfg.basicBlocks.get(1).terminator())
        .isEqualTo(new Terminator.Return(null, Expression.CONSTANT));
  }

  @Test
  public void returnWithoutValueIsConstant() {
    MethodSymbol method = method("Stop").build();

    Ucfg ucfg = build(method, straightLine(returnBlock(ret(null))));

    Terminator.Return terminator = (Terminator.Return) ucfg.basicBlocks.get(0).terminator();
    assertThat(terminator.returnedExpression()).isEqualTo(Expression.CONSTANT);
  }

  @Test
  public void stringParameterIsReturnedAsVariable() {
    MethodSymbol method =
        method("Echo").returns(TypeSymbol.STRING).parameter("s", TypeSymbol.STRING).build();
    SyntaxNode s = ref(method.parameters.get(0));
    SyntaxNode.Return ret = ret(s);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret, s)));

    BasicBlock body = ucfg.basicBlocks.get(0);
    assertThat(body.instructions()).isEmpty();
    assertThat(body.terminator())
        .isEqualTo(new Terminator.Return(locationOf(ret), Expression.variable("s")));
  }

  @Test
  public void concatenationPassesRightOperandFirst() {
    MethodSymbol method =
        method("Join")
            .returns(TypeSymbol.STRING)
            .parameter("a", TypeSymbol.STRING)
            .parameter("b", TypeSymbol.STRING)
            .build();
    SyntaxNode a = ref(method.parameters.get(0));
    SyntaxNode b = ref(method.parameters.get(1));
    SyntaxNode sum = plus(a, b);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret(sum), a, b, sum)));

    BasicBlock body = ucfg.basicBlocks.get(0);
    assertThat(body.instructions())
        .containsExactly(
            new Instruction(
                locationOf(sum),
                KnownMethodId.CONCATENATION,
                "%0",
                ImmutableList.of(Expression.variable("b"), Expression.variable("a"))));
    Terminator.Return terminator = (Terminator.Return) body.terminator();
    assertThat(terminator.returnedExpression()).isEqualTo(Expression.variable("%0"));
  }

  @Test
  public void concatenationWithLiteralUsesConstant() {
    MethodSymbol method =
        method("Greet").returns(TypeSymbol.STRING).parameter("name", TypeSymbol.STRING).build();
    SyntaxNode hello = stringLiteral("Hello ");
    SyntaxNode name = ref(method.parameters.get(0));
    SyntaxNode sum = plus(hello, name);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret(sum), hello, name, sum)));

    assertThat(listing(ucfg.basicBlocks.get(0))).containsExactly("%0 = __concat(name, \"\")");
  }

  @Test
  public void callWithoutStringsIsDropped() {
    MethodSymbol log = method("Log").isStatic(true).parameter("count", INT).build();
    MethodSymbol method = method("Report").parameter("count", INT).build();
    SyntaxNode count = ref(method.parameters.get(0));
    SyntaxNode invocation = call(log, count);

    Ucfg ucfg = build(method, straightLine(simpleBlock(count, invocation)));

    assertThat(ucfg.basicBlocks.get(0).instructions()).isEmpty();
  }

  @Test
  public void nestedInstructionsSurviveDroppedCall() {
    MethodSymbol storeInDb =
        method("StoreInDb").returns(INT).parameter("value", TypeSymbol.STRING).build();
    MethodSymbol logStatus = method("LogStatus").parameter("status", INT).build();
    MethodSymbol method =
        method("Save").parameter("a", TypeSymbol.STRING).parameter("b", TypeSymbol.STRING).build();
    SyntaxNode a = ref(method.parameters.get(0));
    SyntaxNode b = ref(method.parameters.get(1));
    SyntaxNode sum = plus(a, b);
    SyntaxNode store = call(storeInDb, sum);
    SyntaxNode logged = call(logStatus, store);

    Ucfg ucfg = build(method, straightLine(simpleBlock(a, b, sum, store, logged)));

    assertThat(listing(ucfg.basicBlocks.get(0)))
        .containsExactly("%0 = __concat(b, a)", "%1 = Shop.Orders.StoreInDb(System.String)(%0)")
        .inOrder();
  }

  @Test
  public void callIsKeptWhenAnArgumentIsVariable() {
    MethodSymbol print = method("Print").isStatic(true).parameter("o", OBJECT).build();
    MethodSymbol method =
        method("Show").returns(OBJECT).parameter("s", TypeSymbol.STRING).build();
    SyntaxNode s = ref(method.parameters.get(0));
    SyntaxNode invocation = call(print, s);
    SyntaxNode.Return ret = ret(invocation);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret, s, invocation)));

    BasicBlock body = ucfg.basicBlocks.get(0);
    assertThat(body.instructions())
        .containsExactly(
            new Instruction(
                locationOf(invocation),
                "Shop.Orders.Print(System.Object)",
                "%0",
                ImmutableList.of(Expression.variable("s"))));
    // The call is kept, but its result isn't a string.
    assertThat(body.terminator())
        .isEqualTo(new Terminator.Return(locationOf(ret), Expression.CONSTANT));
  }

  @Test
  public void stringInstanceMethodTakesReceiverFirst() {
    MethodSymbol replace =
        MethodSymbol.builder("Replace", TypeSymbol.STRING)
            .returns(TypeSymbol.STRING)
            .parameter("oldValue", TypeSymbol.STRING)
            .parameter("newValue", TypeSymbol.STRING)
            .build();
    MethodSymbol method =
        method("Clean").returns(TypeSymbol.STRING).parameter("s", TypeSymbol.STRING).build();
    SyntaxNode s = ref(method.parameters.get(0));
    SyntaxNode from = stringLiteral("<");
    SyntaxNode to = stringLiteral("");
    SyntaxNode invocation = callOn(s, replace, from, to);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret(invocation), s, from, to, invocation)));

    BasicBlock body = ucfg.basicBlocks.get(0);
    assertThat(listing(body))
        .containsExactly(
            "%0 = System.String.Replace(System.String, System.String)(s, \"\", \"\")");
    Terminator.Return terminator = (Terminator.Return) body.terminator();
    assertThat(terminator.returnedExpression()).isEqualTo(Expression.variable("%0"));
  }

  @Test
  public void staticStringMethodHasNoReceiver() {
    MethodSymbol isNullOrEmpty =
        MethodSymbol.builder("IsNullOrEmpty", TypeSymbol.STRING)
            .isStatic(true)
            .returns(BOOL)
            .parameter("value", TypeSymbol.STRING)
            .build();
    MethodSymbol method = method("Check").parameter("s", TypeSymbol.STRING).build();
    SyntaxNode s = ref(method.parameters.get(0));
    SyntaxNode type = new SyntaxNode.Identifier("string", span());
    SyntaxNode invocation = callOn(type, isNullOrEmpty, s);

    Ucfg ucfg = build(method, straightLine(simpleBlock(s, invocation)));

    assertThat(listing(ucfg.basicBlocks.get(0)))
        .containsExactly("%0 = System.String.IsNullOrEmpty(System.String)(s)");
  }

  @Test
  public void extensionMethodCalledAsExtensionTakesReceiverFirst() {
    TypeSymbol extensions = TypeSymbol.of("Shop.StringExtensions");
    MethodSymbol sanitize =
        MethodSymbol.builder("Sanitize", extensions)
            .isStatic(true)
            .returns(TypeSymbol.STRING)
            .parameter("s", TypeSymbol.STRING)
            .build();
    MethodSymbol reduced =
        MethodSymbol.builder("Sanitize", extensions)
            .returns(TypeSymbol.STRING)
            .reducedFrom(sanitize)
            .build();
    MethodSymbol method =
        method("Clean").returns(TypeSymbol.STRING).parameter("input", TypeSymbol.STRING).build();
    SyntaxNode input = ref(method.parameters.get(0));
    SyntaxNode invocation = callOn(input, reduced);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret(invocation), input, invocation)));

    assertThat(listing(ucfg.basicBlocks.get(0)))
        .containsExactly("%0 = Shop.StringExtensions.Sanitize(System.String)(input)");
  }

  @Test
  public void unresolvedCallIsConstant() {
    MethodSymbol method =
        method("Send").returns(TypeSymbol.STRING).parameter("s", TypeSymbol.STRING).build();
    SyntaxNode s = ref(method.parameters.get(0));
    SyntaxNode invocation = call(new SyntaxNode.Identifier("Mystery", span()), null, s);
    SyntaxNode.Return ret = ret(invocation);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret, s, invocation)));

    BasicBlock body = ucfg.basicBlocks.get(0);
    assertThat(body.instructions()).isEmpty();
    assertThat(body.terminator())
        .isEqualTo(new Terminator.Return(locationOf(ret), Expression.CONSTANT));
  }

  @Test
  public void assignmentToStringLocal() {
    MethodSymbol method = method("Copy").parameter("a", TypeSymbol.STRING).build();
    Symbol.Local x = new Symbol.Local("x", TypeSymbol.STRING);
    SyntaxNode a = ref(method.parameters.get(0));
    SyntaxNode assignment = assign(x, a);

    Ucfg ucfg = build(method, straightLine(simpleBlock(a, assignment)));

    assertThat(ucfg.basicBlocks.get(0).instructions())
        .containsExactly(
            new Instruction(
                locationOf(assignment),
                KnownMethodId.ASSIGNMENT,
                "x",
                ImmutableList.of(Expression.variable("a"))));
  }

  @Test
  public void assignmentToUntrackedTargetIsDropped() {
    MethodSymbol method = method("Copy").parameter("a", TypeSymbol.STRING).build();
    Symbol.Local counter = new Symbol.Local("counter", INT);
    Symbol.Field cache = new Symbol.Field("cache", TypeSymbol.STRING);
    SyntaxNode a = ref(method.parameters.get(0));
    SyntaxNode toInt = assign(counter, a);
    SyntaxNode toField = assign(cache, a);

    Ucfg ucfg = build(method, straightLine(simpleBlock(a, toInt, toField)));

    assertThat(ucfg.basicBlocks.get(0).instructions()).isEmpty();
  }

  @Test
  public void stringDeclaratorWithInitializerIsAssigned() {
    MethodSymbol method = method("Copy").parameter("a", TypeSymbol.STRING).build();
    SyntaxNode a = ref(method.parameters.get(0));
    SyntaxNode withValue = declare(new Symbol.Local("x", TypeSymbol.STRING), a);
    SyntaxNode withoutValue = declare(new Symbol.Local("y", TypeSymbol.STRING), null);
    SyntaxNode number =
        new SyntaxNode.Literal(SyntaxKind.NUMERIC_LITERAL_EXPRESSION, "42", span());
    SyntaxNode notString = declare(new Symbol.Local("n", INT), number);

    Ucfg ucfg =
        build(method, straightLine(simpleBlock(a, withValue, withoutValue, number, notString)));

    assertThat(listing(ucfg.basicBlocks.get(0))).containsExactly("x = __assignment(a)");
    assertThat(ucfg.basicBlocks.get(0).instructions().get(0).location())
        .isEqualTo(locationOf(withValue));
  }

  @Test
  public void propertyReadCallsGetter() {
    MethodSymbol getter =
        method("get_Name").kind(MethodKind.PROPERTY_GET).returns(TypeSymbol.STRING).build();
    Symbol.Property name = new Symbol.Property("Name", TypeSymbol.STRING, getter, null);
    MethodSymbol method = method("Describe").returns(TypeSymbol.STRING).build();
    SyntaxNode read = ref(name);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret(read), read)));

    BasicBlock body = ucfg.basicBlocks.get(0);
    assertThat(listing(body)).containsExactly("%0 = Shop.Orders.get_Name()()");
    assertThat(body.instructions().get(0).location()).isEqualTo(locationOf(read));
    Terminator.Return terminator = (Terminator.Return) body.terminator();
    assertThat(terminator.returnedExpression()).isEqualTo(Expression.variable("%0"));
  }

  @Test
  public void writeOnlyPropertyReadIsConstant() {
    MethodSymbol setter =
        method("set_Secret")
            .kind(MethodKind.PROPERTY_SET)
            .parameter("value", TypeSymbol.STRING)
            .build();
    Symbol.Property secret = new Symbol.Property("Secret", TypeSymbol.STRING, null, setter);
    MethodSymbol method = method("Leak").returns(TypeSymbol.STRING).build();
    SyntaxNode read = ref(secret);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret(read), read)));

    assertThat(ucfg.basicBlocks.get(0).instructions()).isEmpty();
  }

  @Test
  public void propertyWriteCallsSetter() {
    MethodSymbol setter =
        method("set_Name")
            .kind(MethodKind.PROPERTY_SET)
            .parameter("value", TypeSymbol.STRING)
            .build();
    Symbol.Property name = new Symbol.Property("Name", TypeSymbol.STRING, null, setter);
    MethodSymbol method = method("Rename").parameter("s", TypeSymbol.STRING).build();
    SyntaxNode s = ref(method.parameters.get(0));
    SyntaxNode assignment = assign(name, s);

    Ucfg ucfg = build(method, straightLine(simpleBlock(s, assignment)));

    assertThat(listing(ucfg.basicBlocks.get(0)))
        .containsExactly("%0 = Shop.Orders.set_Name(System.String)(s)");
  }

  @Test
  public void objectCreationCallsConstructor() {
    TypeSymbol stringBuilder = TypeSymbol.of("System.Text.StringBuilder");
    MethodSymbol constructor =
        MethodSymbol.builder("StringBuilder", stringBuilder)
            .kind(MethodKind.CONSTRUCTOR)
            .parameter("value", TypeSymbol.STRING)
            .build();
    MethodSymbol method = method("Wrap").returns(OBJECT).parameter("s", TypeSymbol.STRING).build();
    SyntaxNode s = ref(method.parameters.get(0));
    SyntaxNode creation =
        new SyntaxNode.ObjectCreation("StringBuilder", ImmutableList.of(s), span());
    model.bind(creation, constructor);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret(creation), s, creation)));

    assertThat(listing(ucfg.basicBlocks.get(0)))
        .containsExactly("%0 = System.Text.StringBuilder.StringBuilder(System.String)(s)");
  }

  @Test
  public void objectCreationWithoutArgumentListIsFiltered() {
    TypeSymbol options = TypeSymbol.of("Shop.Options");
    MethodSymbol constructor =
        MethodSymbol.builder("Options", options).kind(MethodKind.CONSTRUCTOR).build();
    MethodSymbol method = method("Configure").build();
    SyntaxNode creation = new SyntaxNode.ObjectCreation("Options", null, span());
    model.bind(creation, constructor);

    Ucfg ucfg = build(method, straightLine(simpleBlock(creation)));

    assertThat(ucfg.basicBlocks.get(0).instructions()).isEmpty();
  }

  @Test
  public void nodeIsLoweredOnce() {
    MethodSymbol method =
        method("Join")
            .returns(TypeSymbol.STRING)
            .parameter("a", TypeSymbol.STRING)
            .parameter("b", TypeSymbol.STRING)
            .build();
    SyntaxNode a = ref(method.parameters.get(0));
    SyntaxNode b = ref(method.parameters.get(1));
    SyntaxNode sum = plus(a, b);
    SyntaxNode parenthesized = new SyntaxNode.Parenthesized(sum, span());

    Ucfg ucfg =
        build(method, straightLine(returnBlock(ret(parenthesized), a, b, sum, parenthesized)));

    BasicBlock body = ucfg.basicBlocks.get(0);
    assertThat(listing(body)).containsExactly("%0 = __concat(b, a)");
    Terminator.Return terminator = (Terminator.Return) body.terminator();
    assertThat(terminator.returnedExpression()).isEqualTo(Expression.variable("%0"));
  }

  @Test
  public void identicalExpressionsAreLoweredSeparately() {
    MethodSymbol method =
        method("Twice").parameter("a", TypeSymbol.STRING).parameter("b", TypeSymbol.STRING).build();
    Symbol.Parameter a = method.parameters.get(0);
    Symbol.Parameter b = method.parameters.get(1);
    SyntaxNode a1 = ref(a);
    SyntaxNode b1 = ref(b);
    SyntaxNode first = plus(a1, b1);
    SyntaxNode a2 = ref(a);
    SyntaxNode b2 = ref(b);
    SyntaxNode second = plus(a2, b2);

    Ucfg ucfg = build(method, straightLine(simpleBlock(a1, b1, first, a2, b2, second)));

    assertThat(listing(ucfg.basicBlocks.get(0)))
        .containsExactly("%0 = __concat(b, a)", "%1 = __concat(b, a)")
        .inOrder();
  }

  @Test
  public void temporariesAreNumberedPerBlock() {
    MethodSymbol method =
        method("Twice").parameter("a", TypeSymbol.STRING).parameter("b", TypeSymbol.STRING).build();
    Symbol.Parameter a = method.parameters.get(0);
    Symbol.Parameter b = method.parameters.get(1);
    SyntaxNode a1 = ref(a);
    SyntaxNode b1 = ref(b);
    SyntaxNode first = plus(a1, b1);
    SyntaxNode a2 = ref(a);
    SyntaxNode b2 = ref(b);
    SyntaxNode second = plus(b2, a2);

    Ucfg ucfg =
        build(method, straightLine(simpleBlock(a1, b1, first), simpleBlock(a2, b2, second)));

    assertThat(listing(ucfg.basicBlocks.get(0))).containsExactly("%0 = __concat(b, a)");
    assertThat(listing(ucfg.basicBlocks.get(1))).containsExactly("%0 = __concat(a, b)");
  }

  @Test
  public void missingLocationIsFatal() {
    MethodSymbol method =
        method("Join").parameter("a", TypeSymbol.STRING).parameter("b", TypeSymbol.STRING).build();
    SyntaxNode a = ref(method.parameters.get(0));
    SyntaxNode b = ref(method.parameters.get(1));
    SyntaxNode sum = new SyntaxNode.Binary(SyntaxKind.ADD_EXPRESSION, a, b, null);
    ControlFlowGraph cfg = straightLine(simpleBlock(a, b, sum));

    assertThrows(MissingLocationException.class, () -> build(method, cfg));
  }

  @Test
  public void missingDeclarationLocationIsFatal() {
    MethodSymbol method = method("Touch").build();
    SyntaxNode declaration =
        new SyntaxNode.MethodDeclaration(
            SyntaxKind.METHOD_DECLARATION, "Touch", ImmutableList.of(), null);

    assertThrows(
        MissingLocationException.class,
        () -> builder.build(model, declaration, method, straightLine()));
  }

  @Test
  public void jumpsFollowSuccessorOrder() {
    MethodSymbol method = method("Choose").parameter("flag", BOOL).build();
    SyntaxNode flag = ref(method.parameters.get(0));
    BinaryBranchBlock condition =
        new BinaryBranchBlock(
            ImmutableList.of(flag),
            new SyntaxNode.Statement(SyntaxKind.IF_STATEMENT, "if (flag)", span()));
    SimpleBlock thenBlock = simpleBlock();
    SimpleBlock elseBlock = simpleBlock();
    ExitBlock exit = new ExitBlock();
    condition.linkTo(thenBlock, elseBlock);
    thenBlock.linkTo(exit);
    elseBlock.linkTo(exit);
    ControlFlowGraph cfg =
        ControlFlowGraph.of(
            ImmutableList.of(condition, thenBlock, elseBlock, exit), condition, exit);

    Ucfg ucfg = build(method, cfg);

    assertThat(ucfg.basicBlocks.stream().map(BasicBlock::id).collect(toImmutableList()))
        .containsExactly("0", "1", "2", "3")
        .inOrder();
    assertThat(ucfg.basicBlocks.get(0).terminator())
        .isEqualTo(new Terminator.Jump(ImmutableList.of("1", "2")));
    assertThat(ucfg.basicBlocks.get(1).terminator())
        .isEqualTo(new Terminator.Jump(ImmutableList.of("3")));
    assertThat(ucfg.basicBlocks.get(2).terminator())
        .isEqualTo(new Terminator.Jump(ImmutableList.of("3")));
    assertThat(ucfg.basicBlocks.get(3).terminator())
        .isEqualTo(new Terminator.Return(null, Expression.CONSTANT));
  }

  @Test
  public void loopJumpsBack() {
    MethodSymbol method = method("Spin").parameter("more", BOOL).build();
    SyntaxNode more = ref(method.parameters.get(0));
    BinaryBranchBlock condition =
        new BinaryBranchBlock(
            ImmutableList.of(more),
            new SyntaxNode.Statement(SyntaxKind.WHILE_STATEMENT, "while (more)", span()));
    SimpleBlock body = simpleBlock();
    ExitBlock exit = new ExitBlock();
    condition.linkTo(body, exit);
    body.linkTo(condition);
    ControlFlowGraph cfg =
        ControlFlowGraph.of(ImmutableList.of(condition, body, exit), condition, exit);

    Ucfg ucfg = build(method, cfg);

    assertThat(ucfg.basicBlocks.get(1).terminator())
        .isEqualTo(new Terminator.Jump(ImmutableList.of("0")));
  }

  @Test
  public void basicBlockLookupById() {
    MethodSymbol method = method("Stop").build();
    JumpBlock body = returnBlock(ret(null));

    Ucfg ucfg = build(method, straightLine(body));

    assertThat(ucfg.basicBlock("0")).isSameInstanceAs(ucfg.basicBlocks.get(0));
    assertThat(ucfg.basicBlock("1")).isSameInstanceAs(ucfg.basicBlocks.get(1));
    assertThat(ucfg.basicBlock("2")).isNull();
  }

  private static MethodSymbol fromQueryConstructor() {
    return MethodSymbol.builder(
            "FromQueryAttribute", TypeSymbol.of("Microsoft.AspNetCore.Mvc.FromQueryAttribute"))
        .kind(MethodKind.CONSTRUCTOR)
        .build();
  }

  @Test
  public void entryPointGetsSyntheticEntryBlock() {
    SyntaxNode fromQuerySyntax =
        new SyntaxNode.Attribute("FromQuery", SourceSpan.onLine(FILE, 9, 22, 33));
    AttributeData fromQuery =
        new AttributeData(
            TypeSymbol.of("Microsoft.AspNetCore.Mvc.FromQueryAttribute"),
            fromQueryConstructor(),
            fromQuerySyntax);
    AttributeData unresolved =
        new AttributeData(
            TypeSymbol.of("Shop.Unknown"),
            null,
            new SyntaxNode.Attribute("Unknown", SourceSpan.onLine(FILE, 9, 40, 47)));
    MethodSymbol search =
        MethodSymbol.builder("Search", SEARCH_CONTROLLER)
            .returns(TypeSymbol.STRING)
            .parameter(
                new Symbol.Parameter(
                    "query", TypeSymbol.STRING, ImmutableList.of(fromQuery, unresolved)))
            .parameter("page", INT)
            .build();
    SyntaxNode query = ref(search.parameters.get(0));
    ControlFlowGraph cfg = straightLine(returnBlock(ret(query), query));
    SyntaxNode.MethodDeclaration declaration =
        declarationOf(SyntaxKind.METHOD_DECLARATION, search);

    Ucfg ucfg = new UcfgBuilder().build(model, declaration, search, cfg);

    assertThat(ucfg.entries).containsExactly("2");
    assertThat(ucfg.basicBlocks).hasSize(3);
    BasicBlock entry = ucfg.basicBlock("2");
    assertThat(entry).isSameInstanceAs(ucfg.basicBlocks.get(2));
    assertThat(listing(entry))
        .containsExactly(
            "%0 = __entrypoint(query, page)",
            "%1 = Microsoft.AspNetCore.Mvc.FromQueryAttribute.FromQueryAttribute()()",
            "query = __annotation(%1)")
        .inOrder();
    assertThat(entry.instructions().get(0).location()).isEqualTo(Location.of(declaration));
    assertThat(entry.instructions().get(1).location())
        .isEqualTo(new Location(FILE, 10, 22, 10, 32));
    assertThat(entry.instructions().get(2).location())
        .isEqualTo(new Location(FILE, 10, 22, 10, 32));
    assertThat(entry.terminator()).isEqualTo(new Terminator.Jump(ImmutableList.of("0")));
  }

  @Test
  public void entryPointWithoutParameters() {
    MethodSymbol index = MethodSymbol.builder("Index", SEARCH_CONTROLLER).build();

    Ucfg ucfg =
        new UcfgBuilder()
            .build(
                model, declarationOf(SyntaxKind.METHOD_DECLARATION, index), index, straightLine());

    assertThat(ucfg.entries).containsExactly("1");
    assertThat(listing(ucfg.basicBlock("1"))).containsExactly("%0 = __entrypoint()");
  }

  @Test
  public void nonActionMethodIsNotAnEntryPoint() {
    MethodSymbol helper =
        MethodSymbol.builder("Helper", SEARCH_CONTROLLER)
            .parameter("s", TypeSymbol.STRING)
            .attribute(
                new AttributeData(
                    TypeSymbol.of(KnownType.ASP_NET_CORE_NON_ACTION_ATTRIBUTE.typeName),
                    null,
                    new SyntaxNode.Attribute("NonAction", span())))
            .build();

    Ucfg ucfg =
        new UcfgBuilder()
            .build(
                model,
                declarationOf(SyntaxKind.METHOD_DECLARATION, helper),
                helper,
                straightLine());

    assertThat(ucfg.entries).containsExactly("0");
    assertThat(ucfg.basicBlocks).hasSize(1);
  }

  @Test
  public void accessorIsNeverAnEntryPoint() {
    MethodSymbol getter =
        MethodSymbol.builder("get_Title", SEARCH_CONTROLLER)
            .kind(MethodKind.PROPERTY_GET)
            .returns(TypeSymbol.STRING)
            .build();
    UcfgBuilder everything = new UcfgBuilder(method -> true);

    Ucfg ucfg =
        everything.build(
            model,
            declarationOf(SyntaxKind.GET_ACCESSOR_DECLARATION, getter),
            getter,
            straightLine());

    assertThat(ucfg.entries).containsExactly("0");
    assertThat(ucfg.basicBlocks).hasSize(1);
  }

  @Test
  public void toStringListsBlocks() {
    MethodSymbol method =
        method("Greet").returns(TypeSymbol.STRING).parameter("name", TypeSymbol.STRING).build();
    SyntaxNode hello = stringLiteral("Hello ");
    SyntaxNode name = ref(method.parameters.get(0));
    SyntaxNode sum = plus(hello, name);

    Ucfg ucfg = build(method, straightLine(returnBlock(ret(sum), hello, name, sum)));

    assertThat(ucfg.toString())
        .isEqualTo(
            """
            Shop.Orders.Greet(System.String) @Shop/Orders.cs:10:2-10:29
            parameters: [name]
            entries: [0]
            0:
              %0 = __concat(name, "")
              return %0
            1:
              return ""
            """);
  }

  @Test
  public void verboseBuildGivesSameResult() {
    MethodSymbol method =
        method("Greet").returns(TypeSymbol.STRING).parameter("name", TypeSymbol.STRING).build();
    SyntaxNode name = ref(method.parameters.get(0));
    ControlFlowGraph cfg = straightLine(returnBlock(ret(name), name));
    Ucfg quiet = build(method, cfg);

    builder.verbose = true;
    Ucfg logged = build(method, cfg);

    assertThat(logged.toString()).isEqualTo(quiet.toString());
  }
}
