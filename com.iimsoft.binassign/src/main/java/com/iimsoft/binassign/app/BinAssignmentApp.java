package com.iimsoft.binassign.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.binassign.api.dto.SolveRequest;
import com.iimsoft.binassign.api.dto.SolveResponse;
import com.iimsoft.binassign.exception.AssignmentException;
import com.iimsoft.binassign.exception.ConsistencyException;
import com.iimsoft.binassign.exception.InfeasibleException;
import com.iimsoft.binassign.exception.ModelException;
import com.iimsoft.binassign.exception.ValidationException;
import com.iimsoft.binassign.service.BinAssignmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 统一入口：从 JSON 请求调用 BinAssignmentService，结果以 JSON 输出到 stdout。
 *
 * 用法：
 * - 读取文件：mvn exec:java -Dexec.args=path/to/request.json
 * - 读取 stdin：mvn exec:java -Dexec.args=- < request.json
 * - 无参数：使用内置示例 example_request.json
 */
public class BinAssignmentApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinAssignmentApp.class);

    static final String EXAMPLE_REQUEST = "/example_request.json";

    public static void main(String[] args) throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        SolveRequest request;
        String input = (args == null || args.length == 0 || args[0] == null) ? "" : args[0].trim();
        if (input.isEmpty()) {
            try (InputStream in = BinAssignmentApp.class.getResourceAsStream(EXAMPLE_REQUEST)) {
                if (in == null) {
                    System.err.println("内置示例不存在：" + EXAMPLE_REQUEST);
                    System.exit(2);
                    return;
                }
                request = mapper.readValue(in, SolveRequest.class);
            }
        } else if ("-".equals(input)) {
            try (InputStream in = System.in) {
                request = mapper.readValue(in, SolveRequest.class);
            }
        } else {
            Path path = Path.of(input);
            if (!Files.exists(path) || Files.isDirectory(path)) {
                System.err.println("请求文件不存在或是目录：" + path.toAbsolutePath());
                System.exit(2);
                return;
            }
            request = mapper.readValue(new File(path.toString()), SolveRequest.class);
        }

        SolveResponse response = run(new BinAssignmentService(), request);
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
        if (response.error != null) {
            System.exit(1);
        }
    }

    /**
     * 执行请求；引擎错误转换为带错误类型的响应。
     */
    static SolveResponse run(BinAssignmentService service, SolveRequest request) {
        try {
            return service.solve(request);
        } catch (AssignmentException e) {
            LOGGER.error("Solve request failed: {}", e.getMessage());
            return SolveResponse.failure(errorKind(e), e.getMessage(), e.getSubjectId());
        }
    }

    static String errorKind(AssignmentException e) {
        if (e instanceof ValidationException) return "VALIDATION_ERROR";
        if (e instanceof ModelException) return "MODEL_ERROR";
        if (e instanceof InfeasibleException) return "INFEASIBLE";
        if (e instanceof ConsistencyException) return "CONSISTENCY_ERROR";
        return "ERROR";
    }
}
