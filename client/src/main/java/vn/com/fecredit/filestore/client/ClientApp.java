package vn.com.fecredit.filestore.client;

import vn.com.fecredit.filestore.model.FinishResponse;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line front end of {@link FileStoreClient}.
 *
 * <pre>
 * upload   --url=... --file=... [--name=...] [--sessionId=...]
 * download --url=... --artifact=... --out=...
 * </pre>
 */
public class ClientApp {

    public static void main(String[] args) {
        if (args.length == 0 || args[0].equalsIgnoreCase("--help")) {
            printHelp();
            return;
        }
        System.exit(run(args));
    }

    static int run(String[] args) {
        String command = args[0];
        Map<String, String> params = parseArgs(args);
        if (!params.containsKey("url")) {
            System.err.println("Error: Missing required argument: url");
            printHelp();
            return 1;
        }

        try {
            FileStoreClient client = new FileStoreClient.Builder()
                    .baseUrl(params.get("url"))
                    .tenant(params.get("tenant"))
                    .chunkSize(Integer.parseInt(params.getOrDefault("chunkSize", String.valueOf(1024 * 1024))))
                    .retryTimes(Integer.parseInt(params.getOrDefault("retryTimes", "3")))
                    .threadCounts(Integer.parseInt(params.getOrDefault("threadCounts", "4")))
                    .build();

            switch (command) {
                case "upload":
                    return upload(client, params);
                case "download":
                    return download(client, params);
                default:
                    System.err.println("Error: Unknown command: " + command);
                    printHelp();
                    return 1;
            }
        } catch (RuntimeException e) {
            System.err.println(command + " failed: " + e.getMessage());
            if (e.getCause() != null) {
                System.err.println("Cause: " + e.getCause().getMessage());
            }
            return 1;
        }
    }

    private static int upload(FileStoreClient client, Map<String, String> params) {
        if (!params.containsKey("file")) {
            System.err.println("Error: Missing required argument: file");
            return 1;
        }
        Path file = Paths.get(params.get("file"));
        String name = params.getOrDefault("name", file.getFileName().toString());
        String sessionId = params.get("sessionId");

        System.out.println("Starting upload for file: " + file);
        FinishResponse stored = sessionId == null
                ? client.upload(file, name)
                : client.resumeUpload(sessionId, file, name);
        System.out.println("Upload completed. Artifact: " + stored.getArtifactId()
                + " (" + stored.getSize() + " bytes, sha256 " + stored.getDigestHex() + ")");
        return 0;
    }

    private static int download(FileStoreClient client, Map<String, String> params) {
        if (!params.containsKey("artifact") || !params.containsKey("out")) {
            System.err.println("Error: Missing required arguments: artifact, out");
            return 1;
        }
        long size = client.download(params.get("artifact"), Paths.get(params.get("out")));
        System.out.println("Download completed: " + params.get("out") + " (" + size + " bytes)");
        return 0;
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> params = new HashMap<>();
        for (String arg : args) {
            if (arg.startsWith("--")) {
                String[] parts = arg.substring(2).split("=", 2);
                if (parts.length == 2) {
                    params.put(parts[0], parts[1]);
                }
            }
        }
        return params;
    }

    private static void printHelp() {
        System.out.println("Usage: filestore-client <upload|download> [options]");
        System.out.println("Common options:");
        System.out.println("  --url=<url>            : Required. Server root (e.g., http://localhost:8080).");
        System.out.println("  --tenant=<id>          : Optional. Tenant sent in the X-Tenant-Id header.");
        System.out.println("  --retryTimes=<num>     : Optional. Retries for failed requests (default: 3).");
        System.out.println("upload:");
        System.out.println("  --file=<path>          : Required. File to upload.");
        System.out.println("  --name=<name>          : Optional. Stored name (default: the file name).");
        System.out.println("  --sessionId=<id>       : Optional. Resume this interrupted upload.");
        System.out.println("  --chunkSize=<bytes>    : Optional. Chunk size (default: 1048576).");
        System.out.println("  --threadCounts=<num>   : Optional. Parallel upload threads (default: 4).");
        System.out.println("download:");
        System.out.println("  --artifact=<path>      : Required. Artifact id returned by upload.");
        System.out.println("  --out=<path>           : Required. Local file; an existing prefix is resumed.");
        System.out.println("  --help                 : Print this help message.");
    }
}
