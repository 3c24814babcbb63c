package com.complexity.analyzer.parser;

import com.complexity.analyzer.CommonTest;
import com.complexity.analyzer.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestPseudocodeParser extends CommonTest {

    @DisplayName("insertion sort")
    @Test
    public void test1() {
        Program program = parse(INSERTION_SORT);
        assertEquals(1, program.getItems().size());
        ForStatement outer = (ForStatement) program.getItems().get(0);
        assertEquals("j", outer.getVariable());
        assertEquals(ForStatement.Direction.TO, outer.getDirection());
        assertTrue(outer.concreteTripCount().isEmpty());

        List<Statement> body = outer.getBody().getStatements();
        assertEquals(4, body.size());
        assertEquals("key ← A[j]", body.get(0).header());
        assertEquals("i ← j - 1", body.get(1).header());
        WhileStatement inner = (WhileStatement) body.get(2);
        assertEquals("while i > 0 and A[i] > key do", inner.header());
        assertEquals(2, inner.getBody().getStatements().size());
        assertEquals(7, body.get(3).getLine());

        assertEquals(1, program.findAll(WhileStatement.class).size());
        assertEquals(5, program.findAll(AssignmentStatement.class).size());
    }

    @DisplayName("else after a nested if at the same indentation belongs to the nested if")
    @Test
    public void test2() {
        Program program = parse("""
                if a > 0 then
                    if b > 0 then
                        x ← 1
                    else
                        x ← 2
                """);
        IfStatement outer = (IfStatement) program.getItems().get(0);
        assertTrue(outer.getElseBranch().isEmpty());
        IfStatement inner = (IfStatement) outer.getThenBranch().getStatements().get(0);
        assertEquals("x ← 2", inner.getElseBranch().orElseThrow().getStatements().get(0).header());
    }

    @DisplayName("dedented else belongs to the outer if")
    @Test
    public void test3() {
        Program program = parse("""
                if a > 0 then
                    if b > 0 then
                        x ← 1
                else
                    x ← 2
                """);
        IfStatement outer = (IfStatement) program.getItems().get(0);
        assertTrue(outer.getElseBranch().isPresent());
        IfStatement inner = (IfStatement) outer.getThenBranch().getStatements().get(0);
        assertTrue(inner.getElseBranch().isEmpty());
    }

    @DisplayName("single-line if with else")
    @Test
    public void test4() {
        Program program = parse("if a < b then m ← a else m ← b\nx ← m");
        assertEquals(2, program.getItems().size());
        IfStatement ifStatement = (IfStatement) program.getItems().get(0);
        assertEquals("m ← a", ifStatement.getThenBranch().getStatements().get(0).header());
        assertEquals("m ← b", ifStatement.getElseBranch().orElseThrow().getStatements().get(0).header());
    }

    @DisplayName("function declaration versus call statement")
    @Test
    public void test5() {
        Program program = parse("""
                Max(a, b)
                    if a > b then
                        return a
                    return b
                Print(A, n)
                m ← Max(x, y)
                """);
        assertEquals(3, program.getItems().size());
        List<FunctionDeclaration> functions = program.getFunctions();
        assertEquals(1, functions.size());
        assertEquals("Max", functions.get(0).getName());
        assertEquals(List.of("a", "b"), functions.get(0).getParameters());
        assertEquals(2, functions.get(0).getBody().getStatements().size());

        assertEquals(Statement.Kind.CALL, program.getItems().get(1).getKind());
        CallStatement call = (CallStatement) program.getItems().get(1);
        assertEquals("Print", call.getName());
        assertEquals(2, call.getArguments().size());
        AssignmentStatement assignment = (AssignmentStatement) program.getItems().get(2);
        assertEquals(Expression.Kind.CALL, assignment.getValue().getKind());
    }

    @DisplayName("operator precedence")
    @Test
    public void test6() {
        AssignmentStatement s1 = (AssignmentStatement) parse("x ← a + b * c").getItems().get(0);
        BinaryExpression sum = (BinaryExpression) s1.getValue();
        assertEquals(Operator.PLUS, sum.getOperator());
        assertEquals(Operator.TIMES, ((BinaryExpression) sum.getRight()).getOperator());

        AssignmentStatement s2 = (AssignmentStatement) parse("x ← (a + b) * c").getItems().get(0);
        assertEquals("(a + b) * c", s2.getValue().toString());

        IfStatement s3 = (IfStatement) parse("if not x = 1 or y then z ← 0").getItems().get(0);
        BinaryExpression or = (BinaryExpression) s3.getCondition();
        assertEquals(Operator.OR, or.getOperator());
        UnaryExpression not = (UnaryExpression) or.getLeft();
        assertEquals(Operator.NOT, not.getOperator());
        assertEquals(Operator.EQUAL, ((BinaryExpression) not.getOperand()).getOperator());
    }

    @DisplayName("for loop with literal bounds and downto")
    @Test
    public void test7() {
        ForStatement up = (ForStatement) parse("for i ← 1 to 10 do\n    s ← s + i").getItems().get(0);
        assertEquals(BigInteger.TEN, up.concreteTripCount().orElseThrow());
        ForStatement down = (ForStatement) parse("for i ← 10 downto 1 do s ← s + i").getItems().get(0);
        assertEquals(ForStatement.Direction.DOWNTO, down.getDirection());
        assertEquals(BigInteger.TEN, down.concreteTripCount().orElseThrow());
        ForStatement empty = (ForStatement) parse("for i ← 5 to 1 do s ← s + i").getItems().get(0);
        assertEquals(BigInteger.ZERO, empty.concreteTripCount().orElseThrow());
    }

    @Test
    public void testWrongAssignmentOperator() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("x = 1"));
        assertEquals(1, e.getLine());
        assertEquals(3, e.getColumn());
        assertTrue(e.getMessage().endsWith("Expected '←' after x but found '='"), e.getMessage());

        assertThrows(SyntaxException.class, () -> parser.parse("x := 1"));
        assertFalse(parser.validate("x := 1"));
        assertFalse(parser.validate("x <- 1"));
    }

    @DisplayName("non-ASCII digit is a syntax error, not a crash")
    @Test
    public void testNonAsciiDigit() {
        assertFalse(parser.validate("x ← \u0663"));
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("x ← \u0663"));
        assertEquals(5, e.getColumn());
        assertFalse(parser.validate("for i ← 1 to \u0663 do\n    x ← 1"));
    }

    @Test
    public void testMissingDo() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("for i ← 1 to n\n    x ← 1"));
        assertEquals(2, e.getLine());
        assertEquals(5, e.getColumn());
        assertTrue(e.getMessage().contains("Expected 'do' but found 'x'"), e.getMessage());
    }

    @Test
    public void testEmptyBlock() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("while x > 0 do\ny ← 1"));
        assertEquals(2, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    public void testEmptyInput() {
        assertThrows(SyntaxException.class, () -> parser.parse(""));
        assertThrows(SyntaxException.class, () -> parser.parse("   // nothing but a comment\n"));
        assertThrows(SyntaxException.class, () -> parser.parse(null));
    }

    @DisplayName("validate agrees with parse")
    @Test
    public void testValidate() {
        List<String> inputs = List.of(INSERTION_SORT, LINEAR_SEARCH, "x ← 1", "x ← ", "for i ← 1 to n do",
                "if x then y ← 1 else", "return", "break", "y ← f(1, 2", "x ← [1]", "Sort the list please");
        for (String input : inputs) {
            boolean parses;
            try {
                parser.parse(input);
                parses = true;
            } catch (SyntaxException e) {
                parses = false;
            }
            assertEquals(parses, parser.validate(input), input);
        }
        assertTrue(parser.validate(INSERTION_SORT));
        assertFalse(parser.validate("Sort the list please"));
    }

    @DisplayName("pre-order walk is restartable")
    @Test
    public void testPreOrder() {
        Program program = parse(LINEAR_SEARCH);
        long first = program.stream().count();
        assertEquals(first, program.stream().count());
        assertSame(program, program.preOrder().iterator().next());
        assertEquals(1, program.findAll(BreakStatement.class).size());

        int line = 0;
        for (Node node : parse(INSERTION_SORT).preOrder()) {
            assertTrue(node.getLine() >= line, node.toString());
            line = node.getLine();
        }
    }
}
