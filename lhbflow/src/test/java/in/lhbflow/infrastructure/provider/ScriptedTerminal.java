package in.lhbflow.infrastructure.provider;

import in.lhbflow.infrastructure.terminal.RawResponse;
import in.lhbflow.infrastructure.terminal.TerminalClient;
import in.lhbflow.infrastructure.terminal.TerminalOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory terminal answering from a script, recording every call.
 */
class ScriptedTerminal implements TerminalClient {

    @FunctionalInterface
    interface Script {
        RawResponse answer(TerminalOperation operation, List<String> params);
    }

    record Call(TerminalOperation operation, List<String> params) {}

    private final Script script;
    private final List<Call> calls = new ArrayList<>();
    private final AtomicInteger logins = new AtomicInteger();
    private volatile int loginCode = 0;

    ScriptedTerminal(Script script) {
        this.script = script;
    }

    ScriptedTerminal loginCode(int code) {
        this.loginCode = code;
        return this;
    }

    @Override
    public int login(String userId, String secret) {
        logins.incrementAndGet();
        return loginCode;
    }

    @Override
    public void logout() {
    }

    @Override
    public synchronized RawResponse invoke(TerminalOperation operation, List<String> params) {
        calls.add(new Call(operation, List.copyOf(params)));
        return script.answer(operation, params);
    }

    @Override
    public String getName() {
        return "SCRIPTED";
    }

    synchronized List<Call> calls() {
        return List.copyOf(calls);
    }

    synchronized long count(TerminalOperation operation) {
        return calls.stream().filter(c -> c.operation() == operation).count();
    }

    int logins() {
        return logins.get();
    }
}
