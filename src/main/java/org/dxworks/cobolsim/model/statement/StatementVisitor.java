package org.dxworks.cobolsim.model.statement;

public interface StatementVisitor<R> {
    R visitMove(MoveStatement statement);

    R visitArithmetic(ArithmeticStatement statement);

    R visitCompute(ComputeStatement statement);

    R visitIf(IfStatement statement);

    R visitPerform(PerformStatement statement);

    R visitDisplay(DisplayStatement statement);

    R visitAccept(AcceptStatement statement);

    R visitCall(CallStatement statement);

    R visitExitProgram(ExitProgramStatement statement);

    R visitGoback(GobackStatement statement);

    R visitStopRun(StopRunStatement statement);

    R visitOpen(OpenStatement statement);

    R visitClose(CloseStatement statement);

    R visitRead(ReadStatement statement);

    R visitWrite(WriteStatement statement);

    R visitExecCics(ExecCicsStatement statement);
}
