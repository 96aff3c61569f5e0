module dev.mars.flowdraw.core {
    requires org.slf4j;

    exports dev.mars.flowdraw.model;
    exports dev.mars.flowdraw.config;
    exports dev.mars.flowdraw.core.exceptions;
}
