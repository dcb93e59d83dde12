package biz.kryukov.dev.svcregistry.checks;

import biz.kryukov.dev.svcregistry.CheckConnectionException;
import biz.kryukov.dev.svcregistry.CheckDnsException;
import biz.kryukov.dev.svcregistry.CheckOutcome;
import biz.kryukov.dev.svcregistry.EndpointView;
import biz.kryukov.dev.svcregistry.Protocol;
import biz.kryukov.dev.svcregistry.ServiceChecker;

import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Set;

/**
 * TCP health checker: establishes a fresh TCP connection to the service and closes it.
 */
public final class TcpServiceChecker implements ServiceChecker {

    @Override
    public CheckOutcome check(EndpointView endpoint) {
        long startNs = System.nanoTime();
        int timeoutMs = (int) endpoint.endpoint().timeout().toMillis();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(endpoint.host(), endpoint.port()), timeoutMs);
            return CheckOutcome.healthy(Duration.ofNanos(System.nanoTime() - startNs));
        } catch (UnknownHostException e) {
            return CheckOutcome.failure(
                    new CheckDnsException("host not found: " + endpoint.host(), e),
                    Duration.ofNanos(System.nanoTime() - startNs));
        } catch (ConnectException e) {
            return CheckOutcome.failure(
                    new CheckConnectionException("connection refused: " + endpoint.host() + ":"
                            + endpoint.port(), e),
                    Duration.ofNanos(System.nanoTime() - startNs));
        } catch (Exception e) {
            return CheckOutcome.failure(e, Duration.ofNanos(System.nanoTime() - startNs));
        }
    }

    @Override
    public Set<Protocol> protocols() {
        return Set.of(Protocol.TCP);
    }
}
