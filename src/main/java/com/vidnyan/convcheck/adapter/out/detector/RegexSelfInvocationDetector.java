package com.vidnyan.convcheck.adapter.out.detector;

import com.vidnyan.convcheck.application.port.out.SelfInvocationDetector;
import com.vidnyan.convcheck.domain.model.SourceFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text heuristic for self-invocation.
 * A public method whose {@code name(} appears more than once in the file (the
 * declaration included) is considered called from within the class. Identifiers
 * are not resolved, so a same-named call on another object counts too.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "convcheck.proxy.detector", havingValue = "regex", matchIfMissing = true)
public class RegexSelfInvocationDetector implements SelfInvocationDetector {

    static final Pattern BEAN_METHOD = Pattern.compile("public\\s\\w+(<\\w+>)*\\s(\\w+)\\(");

    @Override
    public Set<String> findSelfInvokedMethods(SourceFile configurationClass) {
        String text = configurationClass.content();

        List<String> methodNames = new ArrayList<>();
        Matcher matcher = BEAN_METHOD.matcher(text);
        while (matcher.find()) {
            methodNames.add(matcher.group(2));
        }

        Set<String> selfInvoked = new LinkedHashSet<>();
        for (String name : methodNames) {
            int count = countOccurrences(text, name);
            if (count > 1) {
                log.debug("{}: {}( appears {} times", configurationClass.fileName(), name, count);
                selfInvoked.add(name);
            }
        }
        return selfInvoked;
    }

    private int countOccurrences(String text, String methodName) {
        Matcher call = Pattern.compile(Pattern.quote(methodName) + "\\(").matcher(text);
        int count = 0;
        while (call.find()) {
            count++;
        }
        return count;
    }
}
