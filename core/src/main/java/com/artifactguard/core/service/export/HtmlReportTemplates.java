package com.artifactguard.core.service.export;

import com.artifactguard.core.model.Severity;

import java.util.Locale;
import java.util.Map;

/** HTML 보고서 공용 조각 (스타일/헤더/심각도 막대/푸터) */
final class HtmlReportTemplates {
    private HtmlReportTemplates() {}

    static String css() {
        return """
        <style>
        :root{
          --bg:#ffffff; --fg:#0f172a; --muted:#475569;
          --card:#ffffff; --bd:#e2e8f0; --row:#f8fafc; --chip:#e5e7eb; --barbg:#e5e7eb;
          --crit:#b91c1c; --hi:#dc2626; --med:#d97706; --low:#16a34a; --unk:#64748b;
          --link:#2563eb;
        }
        @media (prefers-color-scheme: dark){
          :root{
            --bg:#0f172a; --fg:#e5e7eb; --muted:#94a3b8;
            --card:#0b1220; --bd:#2a3343; --row:#0e1624; --chip:#1f2937; --barbg:#1f2937;
            --crit:#dc2626; --hi:#ef4444; --med:#f59e0b; --low:#22c55e; --unk:#94a3b8;
            --link:#60a5fa;
          }
        }
        html,body{margin:0;padding:0;background:var(--bg);color:var(--fg);font:14px/1.6 system-ui,-apple-system,Segoe UI,Roboto,Ubuntu,'Noto Sans',sans-serif}
        a{color:var(--link)}
        .muted{color:var(--muted)}
        .wrap{padding:12px 24px 48px}
        header{padding:16px 24px;border-bottom:1px solid var(--bd)}
        header h1{font-size:20px;margin:0 0 6px}
        h2{font-size:18px;margin:16px 0 8px}
        .card{background:var(--card);border:1px solid var(--bd);border-radius:12px;padding:14px;margin:12px 0;box-shadow:0 1px 2px rgba(0,0,0,.12)}
        .grid{display:grid;grid-template-columns:repeat(auto-fit,minmax(180px,1fr));gap:12px}
        .stat{font-size:24px;font-weight:700}
        .chips{margin:.25rem 0}
        .chip{display:inline-block;padding:.28rem .6rem;border-radius:.6rem;background:var(--chip);margin-right:.35rem;font-weight:700}
        .sev-CRITICAL{color:var(--crit);font-weight:700}
        .sev-HIGH{color:var(--hi);font-weight:700}
        .sev-MEDIUM{color:var(--med);font-weight:700}
        .sev-LOW{color:var(--low);font-weight:700}
        .sev-UNKNOWN{color:var(--unk)}
        .chip.sev-CRITICAL{background:var(--crit);color:#fff}
        .chip.sev-HIGH{background:var(--hi);color:#fff}
        .chip.sev-MEDIUM{background:var(--med);color:#111}
        .chip.sev-LOW{background:var(--low);color:#0b1220}
        .chip.sev-UNKNOWN{background:var(--unk);color:#fff}
        .bar{height:14px;background:var(--barbg);border-radius:7px;overflow:hidden;margin:.5rem 0 .9rem;display:flex}
        .bar>i{display:block;height:100%}
        table{width:100%;border-collapse:separate;border-spacing:0;border:1px solid var(--bd);border-radius:12px;overflow:hidden;background:var(--card)}
        thead th{border-bottom:1px solid var(--bd);padding:10px;text-align:left;font-weight:800}
        tbody td{padding:10px;border-bottom:1px solid var(--bd);vertical-align:top}
        tbody tr:nth-child(even){background:var(--row)}
        .vuln{border-left:4px solid var(--unk);padding:8px 12px;margin:8px 0}
        .vuln.CRITICAL{border-left-color:var(--crit)}
        .vuln.HIGH{border-left-color:var(--hi)}
        .vuln.MEDIUM{border-left-color:var(--med)}
        .vuln.LOW{border-left-color:var(--low)}
        .vuln h4{margin:4px 0}
        .vuln p{margin:2px 0}
        .empty{text-align:center;padding:20px}
        @media print{ header{border:none} .card{box-shadow:none} }
        </style>
        """;
    }

    static String open(String title) {
        return "<!doctype html><html lang='en'><head><meta charset='utf-8'>"
                + "<meta name='viewport' content='width=device-width,initial-scale=1'>"
                + "<title>" + esc(title) + "</title>" + css() + "</head><body>";
    }

    static String header(String title, String subtitle) {
        return """
        <header id="top">
          <h1>%s</h1>
          <div class="muted">%s</div>
        </header>
        <div class="wrap">
        """.formatted(esc(title), esc(subtitle));
    }

    /** 숫자 하나짜리 요약 칸 */
    static String stat(String label, long value) {
        return "<div class='card'><div class='stat'>" + value + "</div><div class='muted'>"
                + esc(label) + "</div></div>";
    }

    /** 심각도별 칩 + 비율 막대. counts는 Severity 선언 순서로 순회 */
    static String severityBar(Map<Severity, Long> counts) {
        long total = 0;
        for (Severity s : Severity.values()) total += counts.getOrDefault(s, 0L);

        StringBuilder chips = new StringBuilder("<div class='chips'>");
        StringBuilder bar = new StringBuilder("<div class='bar'>");
        for (Severity s : Severity.values()) {
            long n = counts.getOrDefault(s, 0L);
            chips.append("<span class='chip sev-").append(s.name()).append("'>")
                 .append(s.name()).append(": ").append(n).append("</span>");
            if (total > 0 && n > 0) {
                bar.append(String.format(Locale.ROOT, "<i class='sev-%s' style='width:%.1f%%;background:var(%s)'></i>",
                        s.name(), n * 100.0 / total, colorVar(s)));
            }
        }
        return chips.append("</div>").append(bar).append("</div>").toString();
    }

    static String footer() {
        return """
        <footer class='muted' style='margin-top:16px'>
          <a href="#top" style="text-decoration:none">Back to top</a>
        </footer>
        </div>
        </body></html>
        """;
    }

    private static String colorVar(Severity s) {
        return switch (s) {
            case CRITICAL -> "--crit";
            case HIGH -> "--hi";
            case MEDIUM -> "--med";
            case LOW -> "--low";
            case UNKNOWN -> "--unk";
        };
    }

    static String esc(Object o) {
        if (o == null) return "";
        return String.valueOf(o).replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;")
                .replace("\"", "&quot;").replace("'", "&#39;");
    }

    /** 비었으면 대체 문구 */
    static String escOr(String s, String fallback) {
        return esc(s == null || s.isBlank() ? fallback : s);
    }
}
