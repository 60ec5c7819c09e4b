package qarunner.recorder;

/**
 * In-page JavaScript used by recording sessions. Captured actions are
 * buffered in {@code sessionStorage}, so they survive same-origin page loads
 * until the next harvest.
 */
final class CaptureScripts {

    /** Installs the capture listeners once per document. {@code arguments[0]}: input types to redact. */
    static final String INSTALL = """
            if (window.__qaRecorderInstalled) { return false; }
            window.__qaRecorderInstalled = true;
            var KEY = '__qaRecorderBuffer';
            var redact = arguments[0] || [];

            function selectorOf(el) {
              if (!(el instanceof Element)) { return null; }
              if (el.id) { return '#' + CSS.escape(el.id); }
              var name = el.getAttribute('name');
              if (name) { return el.tagName.toLowerCase() + '[name=' + JSON.stringify(name) + ']'; }
              var parts = [];
              while (el && el.nodeType === 1 && el !== document.documentElement) {
                if (el.id) { parts.unshift('#' + CSS.escape(el.id)); break; }
                var part = el.tagName.toLowerCase();
                var parent = el.parentElement;
                if (parent) {
                  var same = Array.prototype.filter.call(parent.children, function (c) { return c.tagName === el.tagName; });
                  if (same.length > 1) { part += ':nth-of-type(' + (same.indexOf(el) + 1) + ')'; }
                }
                parts.unshift(part);
                el = parent;
              }
              return parts.join(' > ');
            }

            function valueOf(el) {
              var type = (el.getAttribute && el.getAttribute('type') || '').toLowerCase();
              return redact.indexOf(type) >= 0 ? '[REDACTED]' : el.value;
            }

            function push(type, el, value) {
              try {
                var buf = JSON.parse(window.sessionStorage.getItem(KEY) || '[]');
                var selector = selectorOf(el);
                var last = buf.length ? buf[buf.length - 1] : null;
                if (type === 'input' && last && last.type === 'input' && last.selector === selector) {
                  last.value = value;
                  last.timestamp = new Date().toISOString();
                } else {
                  buf.push({ type: type, selector: selector, value: value,
                             url: window.location.href, timestamp: new Date().toISOString() });
                }
                window.sessionStorage.setItem(KEY, JSON.stringify(buf));
              } catch (e) {
                window.__qaRecorderError = String(e);
              }
            }

            document.addEventListener('click', function (e) { push('click', e.target, null); }, true);
            document.addEventListener('input', function (e) {
              if (e.target && e.target.tagName !== 'SELECT') { push('input', e.target, valueOf(e.target)); }
            }, true);
            document.addEventListener('change', function (e) {
              if (e.target && e.target.tagName === 'SELECT') { push('select', e.target, e.target.value); }
            }, true);
            document.addEventListener('submit', function (e) { push('submit', e.target, null); }, true);
            return true;
            """;

    /** Returns the buffered actions as a JSON array string and empties the buffer. */
    static final String DRAIN = """
            var raw = window.sessionStorage.getItem('__qaRecorderBuffer') || '[]';
            window.sessionStorage.removeItem('__qaRecorderBuffer');
            return raw;
            """;

    private CaptureScripts() {}
}
